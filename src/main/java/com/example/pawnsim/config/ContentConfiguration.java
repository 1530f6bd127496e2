package com.example.pawnsim.config;

import com.example.pawnsim.content.ContentRegistry;
import com.example.pawnsim.content.DefaultContent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ContentConfiguration {

    @Bean
    public ContentRegistry contentRegistry() {
        return DefaultContent.create();
    }
}
