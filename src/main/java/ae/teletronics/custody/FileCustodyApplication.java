package ae.teletronics.custody;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FileCustodyApplication {

    public static void main(String[] args) {
        SpringApplication.run(FileCustodyApplication.class, args);
    }
}
