package my.adsoptimizer.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdsOptimizerApplication {
	public static void main(String[] args) {
		SpringApplication.run(AdsOptimizerApplication.class, args);
	}
}
