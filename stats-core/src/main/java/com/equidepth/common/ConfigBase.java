// Copyright 2021-present StarRocks, Inc. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     https://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

// This file is based on code available under the Apache license here:
//   https://github.com/apache/incubator-doris/blob/master/fe/fe-core/src/main/java/org/apache/doris/common/ConfigBase.java

// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package com.equidepth.common;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileReader;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.reflect.Field;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ConfigBase {
    private static final Logger LOG = LogManager.getLogger(ConfigBase.class);

    @Retention(RetentionPolicy.RUNTIME)
    public @interface ConfField {
        boolean mutable() default false;

        String comment() default "";

        /**
         * alias for a configuration defined in Config, used for compatibility reason.
         * when changing a configuration name, you can put the old name in alias annotation.
         * <p>
         * usage: @ConfField(alias = {"old_name1", "old_name2"})
         *
         * @return an array of alias names
         */
        String[] aliases() default {};
    }

    protected Properties props;
    protected static Field[] configFields;
    protected static Map<String, Field> allMutableConfigs = new HashMap<>();

    public void init(String propFile) throws Exception {
        configFields = this.getClass().getFields();
        initAllMutableConfigs();
        props = new Properties();
        try (FileReader reader = new FileReader(propFile)) {
            props.load(reader);
        }

        replacedByEnv();
        setFields();
        LOG.info("loaded {} config items from {}", props.size(), propFile);
    }

    public static void initAllMutableConfigs() {
        allMutableConfigs.clear();
        for (Field field : configFields) {
            ConfField confField = field.getAnnotation(ConfField.class);
            if (confField == null || !confField.mutable()) {
                continue;
            }
            allMutableConfigs.put(field.getName(), field);
            for (String aliasName : confField.aliases()) {
                allMutableConfigs.put(aliasName, field);
            }
        }
    }

    // static accessors may run before init(), fall back to the fields of Config
    private static synchronized Field[] getConfigFields() {
        if (configFields == null) {
            configFields = Config.class.getFields();
            initAllMutableConfigs();
        }
        return configFields;
    }

    public static HashMap<String, String> dump() throws Exception {
        HashMap<String, String> map = new HashMap<String, String>();
        Field[] fields = getConfigFields();
        for (Field f : fields) {
            if (f.getAnnotation(ConfField.class) == null) {
                continue;
            }
            map.put(f.getName(), String.valueOf(f.get(null)));
        }
        return map;
    }

    private void replacedByEnv() throws InvalidConfException {
        Pattern pattern = Pattern.compile("\\$\\{([^\\}]*)\\}");
        for (String key : props.stringPropertyNames()) {
            String value = props.getProperty(key);
            Matcher m = pattern.matcher(value);
            while (m.find()) {
                String envValue = System.getProperty(m.group(1));
                envValue = (envValue != null) ? envValue : System.getenv(m.group(1));
                if (envValue != null) {
                    value = value.replace("${" + m.group(1) + "}", envValue);
                } else {
                    throw new InvalidConfException(ErrorCode.ERROR_CONFIG_UNKNOWN_ENV, m.group(1));
                }
            }
            props.setProperty(key, value);
        }
    }

    private String getConfigValue(String confKey, String[] aliases) {
        String confVal = props.getProperty(confKey);
        if (Strings.isNullOrEmpty(confVal)) {
            for (String aliasName : aliases) {
                confVal = props.getProperty(aliasName);
                if (!Strings.isNullOrEmpty(confVal)) {
                    break;
                }
            }
        }

        return confVal;
    }

    private void setFields() throws Exception {
        Field[] fields = configFields;
        for (Field f : fields) {
            // ensure that field has "@ConfField" annotation
            ConfField anno = f.getAnnotation(ConfField.class);
            if (anno == null) {
                continue;
            }

            // ensure that field has property string
            String confVal = getConfigValue(f.getName(), anno.aliases());
            if (Strings.isNullOrEmpty(confVal)) {
                continue;
            }

            setConfigField(f, confVal);
        }
    }

    private static void validateConfValue(Field f, String confVal) throws InvalidConfException {
        switch (f.getName()) {
            case "histogram_buckets_size":
            case "histogram_collect_log_interval":
                if (Long.parseLong(confVal) < 1) {
                    throw new InvalidConfException(ErrorCode.ERROR_CONFIG_INVALID_VALUE, confVal, f.getName());
                }
                break;
            case "histogram_check_input_order":
                if (!confVal.equalsIgnoreCase("true") && !confVal.equalsIgnoreCase("false")) {
                    throw new InvalidConfException(ErrorCode.ERROR_CONFIG_INVALID_VALUE, confVal, f.getName());
                }
                break;
            default:
                break;
        }
    }

    public static void setConfigField(Field f, String confVal) throws Exception {
        confVal = confVal.trim();
        validateConfValue(f, confVal);

        // set config field
        switch (f.getType().getSimpleName()) {
            case "long":
                f.setLong(null, Long.parseLong(confVal));
                break;
            case "boolean":
                f.setBoolean(null, Boolean.parseBoolean(confVal));
                break;
            default:
                throw new InvalidConfException("unknown type: " + f.getType().getSimpleName());
        }
    }

    public static synchronized void setMutableConfig(String key, String value) throws InvalidConfException {
        getConfigFields();
        Field field = StringUtils.isBlank(key) ? null : allMutableConfigs.get(key);
        if (field == null) {
            throw new InvalidConfException(ErrorCode.ERROR_CONFIG_NOT_EXIST, key);
        }

        try {
            ConfigBase.setConfigField(field, value);
        } catch (InvalidConfException e) {
            LOG.warn("reject config {}={}", key, value, e);
            throw e;
        } catch (Exception e) {
            throw new InvalidConfException("Failed to set config '" + key + "'. err: " + e.getMessage(), e);
        }

        LOG.info("set config {} to {}", key, value);
    }

    /**
     * Returns one row per config item: name, aliases, value, type, mutable and comment.
     * Only items whose name or alias contains {@code pattern} are listed; a blank pattern lists everything.
     */
    public static synchronized List<List<String>> getConfigInfo(String pattern) throws InvalidConfException {
        List<List<String>> configs = Lists.newArrayList();
        Field[] fields = getConfigFields();
        for (Field f : fields) {
            ConfField anno = f.getAnnotation(ConfField.class);
            if (anno == null) {
                continue;
            }

            String confKey = f.getName();
            if (StringUtils.isNotBlank(pattern) && !StringUtils.containsIgnoreCase(confKey, pattern)
                    && Arrays.stream(anno.aliases()).noneMatch(a -> StringUtils.containsIgnoreCase(a, pattern))) {
                continue;
            }
            String confVal;
            try {
                confVal = String.valueOf(f.get(null));
            } catch (IllegalArgumentException | IllegalAccessException e) {
                throw new InvalidConfException("Failed to get config '" + confKey + "'. err: " + e.getMessage(), e);
            }

            List<String> config = Lists.newArrayList();
            config.add(confKey);
            config.add(Arrays.toString(anno.aliases()));
            config.add(Strings.nullToEmpty(confVal));
            config.add(f.getType().getSimpleName());
            config.add(String.valueOf(anno.mutable()));
            config.add(anno.comment());
            configs.add(config);
        }

        return configs;
    }
}
