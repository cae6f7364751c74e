package cafe.woden.chatrelay.youtube;

import cafe.woden.chatrelay.config.RelayProperties;
import cafe.woden.chatrelay.connector.PullConnector;
import cafe.woden.chatrelay.connector.WatermarkPullConnector;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class YouTubeConfig {

  @Bean
  public PullConnector youTubePullConnector(YouTubeFeedTransport transport, RelayProperties props) {
    return new WatermarkPullConnector(transport, props.youtube().batchSize());
  }
}
