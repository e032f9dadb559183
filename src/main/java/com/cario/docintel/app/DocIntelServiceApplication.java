package com.cario.docintel.app;

import com.cario.docintel.app.config.ExtractionProperties;
import com.cario.docintel.app.config.OcrProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the freight document intelligence service.
 *
 * <p>The service recognizes scanned freight documents (CDL, COI, POD, agreements, rate
 * confirmations, invoices, lumper receipts) through OCR providers with failover, then extracts
 * and verifies structured fields.
 *
 * <pre>
 *   mvn spring-boot:run
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableConfigurationProperties({OcrProperties.class, ExtractionProperties.class})
public class DocIntelServiceApplication {

  public static void main(String[] args) {
    log.info("Starting Doc Intel Service application...");
    SpringApplication.run(DocIntelServiceApplication.class, args);
    log.info("Doc Intel Service application started successfully.");
  }
}
