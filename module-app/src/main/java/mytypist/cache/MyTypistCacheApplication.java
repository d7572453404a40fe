package mytypist.cache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MyTypistCacheApplication {

  public static void main(String[] args) {
    SpringApplication.run(MyTypistCacheApplication.class, args);
  }
}
