package io.coko.billing.batch.writer;

import io.coko.billing.batch.BillingRunRepository;
import io.coko.billing.batch.model.RenewalWorkItem;
import org.springframework.batch.item.ItemWriter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RenewalWriterConfig {

  @Bean
  public ItemWriter<RenewalWorkItem> renewalItemWriter(BillingRunRepository repo) {
    return new RenewalItemWriter(repo);
  }
}
