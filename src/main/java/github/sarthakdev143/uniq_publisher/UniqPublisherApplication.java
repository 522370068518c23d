package github.sarthakdev143.uniq_publisher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UniqPublisherApplication {

	public static void main(String[] args) {
		SpringApplication.run(UniqPublisherApplication.class, args);
	}

}
