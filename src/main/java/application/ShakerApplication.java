package application;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"application", "common", "controller", "model", "service"})
public class ShakerApplication {
    public static void main(String[] args) {
        SpringApplication.run(ShakerApplication.class, args);
    }
}
