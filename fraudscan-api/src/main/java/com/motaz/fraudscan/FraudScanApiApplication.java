package com.motaz.fraudscan;

import com.redis.om.spring.annotations.EnableRedisDocumentRepositories;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication
@EnableRedisDocumentRepositories
public class FraudScanApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(FraudScanApiApplication.class, args);
    }

}
