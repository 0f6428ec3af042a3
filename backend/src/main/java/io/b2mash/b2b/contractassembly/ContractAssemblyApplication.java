package io.b2mash.b2b.contractassembly;

import io.b2mash.b2b.contractassembly.config.ContractAssemblyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.web.config.EnableSpringDataWebSupport;
import org.springframework.data.web.config.EnableSpringDataWebSupport.PageSerializationMode;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
@EnableSpringDataWebSupport(pageSerializationMode = PageSerializationMode.VIA_DTO)
@EnableConfigurationProperties(ContractAssemblyProperties.class)
public class ContractAssemblyApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContractAssemblyApplication.class, args);
  }
}
