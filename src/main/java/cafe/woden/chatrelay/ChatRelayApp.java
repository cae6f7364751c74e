package cafe.woden.chatrelay;

import cafe.woden.chatrelay.config.RelayProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "ChatRelay",
    sharedModules = {"config", "model", "util"})
@EnableConfigurationProperties(RelayProperties.class)
public class ChatRelayApp {

  public static void main(String[] args) {
    SpringApplication.run(ChatRelayApp.class, args);
  }
}
