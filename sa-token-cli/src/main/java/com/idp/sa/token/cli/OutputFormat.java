package com.idp.sa.token.cli;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.idp.sa.token.TokenResult;

public enum OutputFormat {
    TEXT {
        @Override
        public String render(TokenResult result, ZoneId zone) {
            StringBuilder out = new StringBuilder()
                .append("Token Generation Result:\n")
                .append("=======================\n")
                .append("Access Token: ").append(result.accessToken()).append('\n')
                .append("Token Type: ").append(result.tokenType()).append('\n')
                .append("Expires In: ").append(result.expiresInSeconds()).append(" seconds\n")
                .append("Expires At: ").append(TEXT_TIME.withZone(zone).format(result.expiresAt())).append('\n');
            if (result.scope() != null && !result.scope().isBlank()) {
                out.append("Scope: ").append(result.scope()).append('\n');
            }
            return out.toString();
        }
    },
    JSON {
        @Override
        public String render(TokenResult result, ZoneId zone) {
            return write(JSON_MAPPER, result) + "\n";
        }
    },
    YAML {
        @Override
        public String render(TokenResult result, ZoneId zone) {
            return write(YAML_MAPPER, result);
        }
    };

    private static final DateTimeFormatter TEXT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT)
        .build();

    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .build();

    public abstract String render(TokenResult result, ZoneId zone);

    public String render(TokenResult result) {
        return render(result, ZoneId.systemDefault());
    }

    private static String write(ObjectMapper mapper, TokenResult result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render token result", e);
        }
    }
}
