package com.example.photomap.webauthn;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.yubico.webauthn.data.RelyingPartyIdentity;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

@Configuration
public class WebAuthnConfig {

    @Bean
    public RelyingPartyIdentity relyingPartyIdentity(WebAuthnProperties properties) {
        return RelyingPartyIdentity.builder()
                .id(properties.getRelyingPartyId())
                .name(properties.getRelyingPartyName())
                .build();
    }

    // Declaring any ObjectMapper bean switches off Boot's default one, so it is rebuilt here.
    @Bean
    @Primary
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder.createXmlMapper(false).build();
    }

    @Bean(name = "webauthnObjectMapper")
    public ObjectMapper webauthnObjectMapper() {
        return JsonMapper.builder().findAndAddModules().build();
    }
}
