package com.platform.netconfig.reconciliation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.platform.netconfig.error.ErrorCode;
import com.platform.netconfig.error.ValidationException;
import com.platform.netconfig.model.NetworkState;
import com.platform.netconfig.validation.Violation;
import com.platform.netconfig.validation.ViolationClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the desired-state document. YAML and JSON are both accepted since
 * JSON is a subset of YAML. Unknown keys are rejected so typos surface as
 * structural violations instead of silently dropped settings.
 */
@Slf4j
@Component
public class DesiredStateLoader {
    
    private final ObjectMapper documentMapper;
    
    public DesiredStateLoader() {
        this.documentMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
    }
    
    /**
     * @throws ValidationException {@code DESIRED_STATE_NOT_FOUND} when the file is missing,
     *                             {@code DESIRED_STATE_UNREADABLE} when it cannot be parsed
     */
    public NetworkState load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ValidationException(ErrorCode.DESIRED_STATE_NOT_FOUND,
                "Desired-state document not found: " + path.toAbsolutePath());
        }
        try {
            String content = Files.readString(path);
            NetworkState state = parse(content);
            log.info("Loaded desired state from {}: {} segments, {} firewall rules",
                path, state.segments().size(), state.firewallRules().size());
            return state;
        } catch (IOException e) {
            throw new ValidationException(ErrorCode.DESIRED_STATE_UNREADABLE,
                "Cannot read " + path + ": " + e.getMessage(), e);
        }
    }
    
    public NetworkState parse(String content) {
        if (content == null || content.isBlank()) {
            return NetworkState.empty();
        }
        try {
            NetworkState state = documentMapper.readValue(content, NetworkState.class);
            return state != null ? state : NetworkState.empty();
        } catch (JsonMappingException e) {
            Object value = e instanceof InvalidFormatException invalid ? invalid.getValue() : null;
            Violation violation = new Violation(
                ViolationClass.STRUCTURAL,
                fieldPath(e),
                value,
                "document-schema",
                e.getOriginalMessage()
            );
            throw new ValidationException(ErrorCode.DESIRED_STATE_UNREADABLE, List.of(violation));
        } catch (JsonProcessingException e) {
            Violation violation = new Violation(
                ViolationClass.STRUCTURAL,
                e.getLocation() != null ? "line " + e.getLocation().getLineNr() : "document",
                null,
                "document-syntax",
                e.getOriginalMessage()
            );
            throw new ValidationException(ErrorCode.DESIRED_STATE_UNREADABLE, List.of(violation));
        }
    }
    
    private String fieldPath(JsonMappingException e) {
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                path.append('[').append(ref.getIndex()).append(']');
            }
        }
        return path.length() > 0 ? path.toString() : "document";
    }
}
