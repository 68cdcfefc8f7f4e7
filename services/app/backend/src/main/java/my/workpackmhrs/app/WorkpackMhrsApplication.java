package my.workpackmhrs.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WorkpackMhrsApplication {
	public static void main(String[] args) {
		SpringApplication.run(WorkpackMhrsApplication.class, args);
	}
}
