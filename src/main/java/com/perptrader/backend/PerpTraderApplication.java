package com.perptrader.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@SpringBootApplication
public class PerpTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(PerpTraderApplication.class, args);
    }

    @Bean
    public WebMvcConfigurer corsConfigurer() {
        return new CorsConfig();
    }

    private static class CorsConfig implements WebMvcConfigurer {
        @Override
        public void addCorsMappings(CorsRegistry registry) {
            registry.addMapping("/api/**")
                   .allowedOrigins("*")
                   .allowedMethods("GET", "POST", "OPTIONS")
                   .allowedHeaders("*");
        }
    }
}
