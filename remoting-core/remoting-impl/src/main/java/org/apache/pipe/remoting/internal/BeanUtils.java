/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.pipe.remoting.internal;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Properties;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.pipe.remoting.api.exception.RemotingRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Populates a config bean from properties, matching each key to the bean's setter of the same name.
 */
public final class BeanUtils {
    private static final Logger LOG = LoggerFactory.getLogger(BeanUtils.class);

    private BeanUtils() {
    }

    public static <T> T populate(final Properties properties, final Class<T> clazz) {
        T instance;
        try {
            instance = clazz.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new RemotingRuntimeException("Cannot instantiate config " + clazz.getName(), e);
        }

        for (String key : properties.stringPropertyNames()) {
            Method setter = findSetter(clazz, key);
            if (setter == null) {
                LOG.warn("Ignore unknown config key {} for {}", key, clazz.getSimpleName());
                continue;
            }

            Object value = convert(key, StringUtils.trim(properties.getProperty(key)), setter.getParameterTypes()[0]);
            try {
                setter.invoke(instance, value);
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new RemotingRuntimeException(String.format("Cannot apply config key %s", key), e);
            }
        }

        return instance;
    }

    private static Method findSetter(Class<?> clazz, String property) {
        String setterName = "set" + StringUtils.capitalize(property);
        for (Method method : clazz.getMethods()) {
            if (method.getName().equals(setterName) && method.getParameterCount() == 1) {
                return method;
            }
        }
        return null;
    }

    private static Object convert(String key, String value, Class<?> type) {
        try {
            if (type == String.class) {
                return value;
            }
            if (type == int.class || type == Integer.class) {
                return Integer.valueOf(value);
            }
            if (type == long.class || type == Long.class) {
                return Long.valueOf(value);
            }
            if (type == boolean.class || type == Boolean.class) {
                Boolean bool = BooleanUtils.toBooleanObject(value);
                if (bool != null) {
                    return bool;
                }
            } else if (type.isEnum()) {
                for (Object constant : type.getEnumConstants()) {
                    if (StringUtils.equalsIgnoreCase(((Enum<?>) constant).name(), value)) {
                        return constant;
                    }
                }
            } else {
                throw new RemotingRuntimeException(String.format("Unsupported type %s of config key %s", type, key));
            }
        } catch (NumberFormatException e) {
            throw new RemotingRuntimeException(String.format("Invalid value '%s' for config key %s", value, key), e);
        }
        throw new RemotingRuntimeException(String.format("Invalid value '%s' for config key %s", value, key));
    }
}
