package tech.yump.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;
import tech.yump.ledger.config.LedgerProperties;

@Slf4j
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(LedgerProperties.class)
public class LiteLedgerApplication {

  public static void main(String[] args) {
    SpringApplication.run(LiteLedgerApplication.class, args);
    log.info(">>> LiteLedger Application Started <<<");
  }
}
