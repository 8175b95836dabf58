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

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AnalysisConfigTest {

    @Test
    public void testDefaultIntervalConfig() {
        AnalysisConfig config = AnalysisConfig.of("interval");
        assertEquals("interval", config.getId());
        assertFalse(config.getDescription().isEmpty());
        assertEquals(10, config.getOptions().getInt("fuel"));
        assertTrue(config.getOptions().getBoolean("strict-lookup"));
    }

    @Test
    public void testReadConfigsFromResource() {
        List<AnalysisConfig> configs = AnalysisConfig.readConfigs("config/analyses-test.yml");
        assertEquals(2, configs.size());
        AnalysisOptions options = configs.get(0).getOptions();
        assertEquals(3, options.getInt("fuel"));
        assertFalse(options.getBoolean("strict-lookup"));
        AnalysisConfig other = configs.get(1);
        assertEquals("other", other.getId());
        assertEquals("", other.getDescription());
        assertFalse(other.getOptions().has("fuel"));
    }

    @Test
    public void testReadConfigsFromStream() {
        String yaml = "- id: interval\n  options:\n    fuel: 7\n    mode: fast\n";
        List<AnalysisConfig> configs = AnalysisConfig.readConfigs(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
        assertEquals(1, configs.size());
        assertEquals(7, configs.get(0).getOptions().getInt("fuel"));
        assertEquals("fast", configs.get(0).getOptions().getString("mode"));
    }

    @Test
    public void testWithOptions() {
        AnalysisConfig config = AnalysisConfig.of("interval");
        AnalysisConfig updated = config.withOptions(Map.of("fuel", 2));
        assertEquals(2, updated.getOptions().getInt("fuel"));
        assertTrue(updated.getOptions().getBoolean("strict-lookup"));
        assertEquals(10, config.getOptions().getInt("fuel"));
    }

    @Test(expected = ConfigException.class)
    public void testUnknownAnalysis() {
        AnalysisConfig.of("no-such-analysis");
    }

    @Test(expected = ConfigException.class)
    public void testMissingResource() {
        AnalysisConfig.readConfigs("config/missing.yml");
    }

    @Test(expected = ConfigException.class)
    public void testMalformedConfig() {
        AnalysisConfig.readConfigs("config/malformed.yml");
    }

    @Test(expected = ConfigException.class)
    public void testMissingOption() {
        new AnalysisOptions(Map.of()).getInt("fuel");
    }

    @Test(expected = ConfigException.class)
    public void testIllTypedOption() {
        new AnalysisOptions(Map.of("fuel", true)).getInt("fuel");
    }

    @Test(expected = ConfigException.class)
    public void testFractionalFuel() {
        AnalysisConfig.of("interval")
                .withOptions(Map.of("fuel", 2.7))
                .getOptions()
                .getInt("fuel");
    }

    @Test(expected = ConfigException.class)
    public void testIntOptionOutOfRange() {
        new AnalysisOptions(Map.of("fuel", 10_000_000_000L)).getInt("fuel");
    }

    @Test
    public void testLongOptionInRange() {
        assertEquals(12, new AnalysisOptions(Map.of("fuel", 12L)).getInt("fuel"));
    }

    @Test
    public void testLargeYamlIntegerIsRejected() {
        String yaml = "- id: interval\n  options:\n    fuel: 10000000000\n";
        AnalysisOptions options = AnalysisConfig.readConfigs(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)))
                .get(0).getOptions();
        try {
            options.getInt("fuel");
            fail("expected ConfigException");
        } catch (ConfigException e) {
            assertTrue(e.getMessage().contains("fuel"));
        }
    }
}
