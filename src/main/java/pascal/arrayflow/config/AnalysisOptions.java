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

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options of an analysis, i.e., a read-only map from option keys to values.
 */
public class AnalysisOptions {

    private final Map<String, Object> options;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public AnalysisOptions(Map<String, Object> options) {
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public boolean has(String key) {
        return options.containsKey(key);
    }

    public Object get(String key) {
        if (!options.containsKey(key)) {
            throw new ConfigException("Option '" + key + "' is not set");
        }
        return options.get(key);
    }

    public String getString(String key) {
        Object value = get(key);
        return value == null ? null : value.toString();
    }

    /**
     * @return the option value as an int. Only integral values in the
     * range of int are accepted.
     */
    public int getInt(String key) {
        Object value = get(key);
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Long || value instanceof BigInteger) {
            try {
                return new BigInteger(value.toString()).intValueExact();
            } catch (ArithmeticException e) {
                throw new ConfigException("Option '" + key
                        + "' is out of the range of int, given: " + value, e);
            }
        }
        throw illegalType(key, "an integer");
    }

    public boolean getBoolean(String key) {
        if (get(key) instanceof Boolean bool) {
            return bool;
        }
        throw illegalType(key, "a boolean");
    }

    /**
     * @return new options in which the given entries override the
     * entries of this object.
     */
    public AnalysisOptions merge(Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(options);
        merged.putAll(overrides);
        return new AnalysisOptions(merged);
    }

    private ConfigException illegalType(String key, String expected) {
        return new ConfigException("Option '" + key + "' should be "
                + expected + ", given: " + options.get(key));
    }

    @Override
    public String toString() {
        return "AnalysisOptions" + options;
    }
}
