package com.iimsoft.planner.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * 规划参数加载（优先级从高到低）：
 * 1) JVM 参数：-Dplanner.settings=JSON
 * 2) classpath 资源 planner-settings.json
 * 3) 内置默认值
 * <p>
 * 配置错误时记录告警并回退默认值，不让程序直接挂掉。
 */
public final class PlannerSettingsLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlannerSettingsLoader.class);

    /** JVM 参数 key */
    public static final String SETTINGS_JSON_PROPERTY = "planner.settings";

    public static final String SETTINGS_RESOURCE = "planner-settings.json";

    private final ObjectMapper mapper = new ObjectMapper();

    public PlannerSettings load() {
        String json = System.getProperty(SETTINGS_JSON_PROPERTY);
        if (json != null && !json.isBlank()) {
            return fromJson(json);
        }
        return fromClasspath(SETTINGS_RESOURCE);
    }

    public PlannerSettings fromJson(String json) {
        try {
            return mapper.readValue(json, PlannerSettings.class);
        } catch (JsonProcessingException e) {
            LOGGER.warn("Invalid planner settings JSON, falling back to defaults: {}", e.getOriginalMessage());
            return PlannerSettings.defaults();
        }
    }

    public PlannerSettings fromClasspath(String resource) {
        ClassLoader classLoader = PlannerSettingsLoader.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                LOGGER.debug("No {} on classpath, using defaults", resource);
                return PlannerSettings.defaults();
            }
            return mapper.readValue(in, PlannerSettings.class);
        } catch (IOException e) {
            LOGGER.warn("Cannot read {} from classpath, falling back to defaults", resource, e);
            return PlannerSettings.defaults();
        }
    }
}
