package vessel.watchlist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VesselWatchlistApplication {

  public static void main(String[] args) {
    SpringApplication.run(VesselWatchlistApplication.class, args);
  }
}
