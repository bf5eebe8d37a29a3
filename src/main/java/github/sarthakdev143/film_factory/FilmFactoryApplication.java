package github.sarthakdev143.film_factory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FilmFactoryApplication {

	public static void main(String[] args) {
		SpringApplication.run(FilmFactoryApplication.class, args);
	}

}
