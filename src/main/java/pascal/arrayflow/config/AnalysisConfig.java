/*
 * Tai-e: A Static Analysis Framework for Java
 *
 * Copyright (C) 2022 Tian Tan <tiantan@nju.edu.cn>
 * Copyright (C) 2022 Yue Li <yueli@nju.edu.cn>
 *
 * This file is part of Tai-e.
 *
 * Tai-e is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License
 * as published by the Free Software Foundation, either version 3
 * of the License, or (at your option) any later version.
 *
 * Tai-e is distributed in the hope that it will be useful,but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY
 * or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General
 * Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public
 * License along with Tai-e. If not, see <https://www.gnu.org/licenses/>.
 */

package pascal.arrayflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of an analysis: its id, a description and its options.
 * Default configurations are read from {@value #DEFAULT_CONFIGS}
 * on the class path.
 */
public class AnalysisConfig {

    private static final Logger logger = LogManager.getLogger(AnalysisConfig.class);

    public static final String DEFAULT_CONFIGS = "analyses.yml";

    private final String id;

    private final String description;

    private final AnalysisOptions options;

    @JsonCreator
    public AnalysisConfig(
            @JsonProperty("id") String id,
            @JsonProperty("description") String description,
            @JsonProperty("options") AnalysisOptions options) {
        this.id = Objects.requireNonNull(id, "analysis id");
        this.description = description != null ? description : "";
        this.options = options != null ? options : new AnalysisOptions(Map.of());
    }

    public AnalysisConfig(String id, AnalysisOptions options) {
        this(id, null, options);
    }

    /**
     * @return the default configuration of the analysis with given id.
     * @throws ConfigException if no such analysis is configured
     */
    public static AnalysisConfig of(String id) {
        return readConfigs(DEFAULT_CONFIGS).stream()
                .filter(config -> config.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new ConfigException(
                        "No configuration for analysis '" + id + "' in " + DEFAULT_CONFIGS));
    }

    /**
     * Reads a list of analysis configurations from a class path resource.
     */
    public static List<AnalysisConfig> readConfigs(String resource) {
        InputStream content = AnalysisConfig.class.getClassLoader()
                .getResourceAsStream(resource);
        if (content == null) {
            throw new ConfigException("Configuration resource " + resource + " not found");
        }
        try (InputStream in = content) {
            List<AnalysisConfig> configs = readConfigs(in);
            logger.debug("Read {} analysis config(s) from {}", configs.size(), resource);
            return configs;
        } catch (IOException e) {
            throw new ConfigException("Failed to close " + resource, e);
        }
    }

    /**
     * Reads a list of analysis configurations in YAML format.
     */
    public static List<AnalysisConfig> readConfigs(InputStream in) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        JavaType type = mapper.getTypeFactory()
                .constructCollectionType(List.class, AnalysisConfig.class);
        try {
            return mapper.readValue(in, type);
        } catch (IOException e) {
            throw new ConfigException("Failed to read analysis configs", e);
        }
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public AnalysisOptions getOptions() {
        return options;
    }

    /**
     * @return a copy of this configuration whose options are overridden
     * by the given entries.
     */
    public AnalysisConfig withOptions(Map<String, Object> overrides) {
        return new AnalysisConfig(id, description, options.merge(overrides));
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "id='" + id + '\'' +
                ", options=" + options +
                '}';
    }
}
