package github.sarthakdev143.matte_embed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MatteEmbedApplication {

	public static void main(String[] args) {
		SpringApplication.run(MatteEmbedApplication.class, args);
	}

}
