/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.ConstructorDetector;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import io.kubecsr.tag.VisibleForTesting;

/**
 * Reads YAML configuration files into immutable configuration records.
 * @param <T> the configuration type
 */
public class ConfigParser<T> {

    private static final ObjectMapper MAPPER = createBaseObjectMapper();

    private final Class<T> configurationType;

    public ConfigParser(Class<T> configurationType) {
        this.configurationType = configurationType;
    }

    public T parseConfiguration(String configuration) {
        try {
            return MAPPER.readValue(configuration, configurationType);
        }
        catch (IOException e) {
            throw new ConfigurationException("Couldn't parse configuration: " + e.getMessage(), e);
        }
    }

    public T parseConfiguration(InputStream configuration) {
        try {
            return MAPPER.readValue(configuration, configurationType);
        }
        catch (IOException e) {
            throw new ConfigurationException("Couldn't parse configuration: " + e.getMessage(), e);
        }
    }

    public T parseConfiguration(Path configuration) {
        try (InputStream in = Files.newInputStream(configuration)) {
            return parseConfiguration(in);
        }
        catch (IOException e) {
            throw new ConfigurationException("Couldn't read configuration file " + configuration, e);
        }
    }

    public String toYaml(T configuration) {
        try {
            return MAPPER.writeValueAsString(configuration);
        }
        catch (JsonProcessingException e) {
            throw new ConfigurationException("Failed to encode configuration as YAML", e);
        }
    }

    /**
     * The object mapper configuration files are read with. Properties bind to record components,
     * unknown and duplicate properties are rejected.
     * @return object mapper
     */
    @VisibleForTesting
    public static ObjectMapper createBaseObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .registerModule(new ParameterNamesModule())
                .registerModule(new Jdk8Module())
                .setVisibility(PropertyAccessor.ALL, Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, Visibility.ANY)
                .setVisibility(PropertyAccessor.CREATOR, Visibility.ANY)
                .setConstructorDetector(ConstructorDetector.USE_PROPERTIES_BASED)
                .enable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.FAIL_ON_MISSING_EXTERNAL_TYPE_ID_PROPERTY)
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                .setSerializationInclusion(JsonInclude.Include.NON_DEFAULT);
    }
}
