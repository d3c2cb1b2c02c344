package com.regdoc.acquirer;

import com.regdoc.acquirer.crawl.http.IdentityHttpClients;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RegdocAcquirerApplication {

  public static void main(String[] args) {
    IdentityHttpClients.allowBasicProxyTunneling();
    SpringApplication.run(RegdocAcquirerApplication.class, args);
  }
}
