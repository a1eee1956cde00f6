/* Copyright (C) 2024-2026 The SubsetLib Authors
 * This file is part of SubsetLib.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.subsetlib.api.setting;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global settings of SubsetLib.
 * <p>
 * Values are read once from the classpath resource {@value #PROPERTIES_RESOURCE} (if present). JVM system properties
 * with the same key take precedence over the values of the resource.
 *
 * @author SubsetLib developers
 */
public final class SubsetLibSettings {

    public static final String PROPERTIES_RESOURCE = "/subsetlib.properties";

    private static final Logger LOGGER = LoggerFactory.getLogger(SubsetLibSettings.class);

    private static final SubsetLibSettings INSTANCE = new SubsetLibSettings(loadResource());

    private final Properties properties;

    SubsetLibSettings(Properties properties) {
        this.properties = properties;
    }

    public static SubsetLibSettings getInstance() {
        return INSTANCE;
    }

    private static Properties loadResource() {
        Properties props = new Properties();
        try (InputStream is = SubsetLibSettings.class.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (is != null) {
                props.load(is);
            }
        } catch (IOException ex) {
            LOGGER.error("Could not load settings from '{}'", PROPERTIES_RESOURCE, ex);
        }
        return props;
    }

    public @Nullable String getProperty(SubsetLibProperty property) {
        String key = property.toString();
        String value = System.getProperty(key);
        if (value == null) {
            value = properties.getProperty(key);
        }
        return value == null ? null : value.trim();
    }

    public String getString(SubsetLibProperty property, String defaultValue) {
        String value = getProperty(property);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    public int getInt(SubsetLibProperty property, int defaultValue) {
        String value = getProperty(property);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            LOGGER.warn("Could not parse integer value '{}' of property '{}', falling back to {}",
                        value,
                        property,
                        defaultValue);
            return defaultValue;
        }
    }

    public <E extends Enum<E>> E getEnumValue(SubsetLibProperty property, Class<E> enumClazz, E defaultValue) {
        String value = getProperty(property);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(enumClazz, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            LOGGER.warn("Unknown value '{}' for property '{}', falling back to {}", value, property, defaultValue);
            return defaultValue;
        }
    }

}
