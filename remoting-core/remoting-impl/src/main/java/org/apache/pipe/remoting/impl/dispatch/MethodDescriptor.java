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

package org.apache.pipe.remoting.impl.dispatch;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.pipe.remoting.api.annotation.Exposed;
import org.apache.pipe.remoting.api.annotation.NotExposed;
import org.apache.pipe.remoting.api.annotation.Param;
import org.apache.pipe.remoting.api.command.MethodInfo;
import org.apache.pipe.remoting.api.command.ParameterInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A public method bound to its target and exposed as a command. Built once at registration, the parameter
 * names, requiredness and generic types are not introspected again per call.
 *
 * <p>Argument binding: a mapping {@code data} is looked up by parameter name, any other {@code data} is passed
 * as the first parameter. Values are converted to the declared parameter type with Jackson.</p>
 */
public final class MethodDescriptor {
    private static final Logger LOG = LoggerFactory.getLogger(MethodDescriptor.class);

    private static final ObjectMapper ARGUMENT_MAPPER = new ObjectMapper();

    private static final Comparator<Method> METHOD_ORDER = new Comparator<Method>() {
        @Override
        public int compare(Method o1, Method o2) {
            int c = o1.getName().compareTo(o2.getName());
            if (c != 0) {
                return c;
            }
            c = Integer.compare(o1.getParameterCount(), o2.getParameterCount());
            if (c != 0) {
                return c;
            }
            return Arrays.toString(o1.getParameterTypes()).compareTo(Arrays.toString(o2.getParameterTypes()));
        }
    };

    private final String name;
    private final Object target;
    private final Method method;
    private final List<ParameterDescriptor> parameters;
    private final String doc;

    private MethodDescriptor(String name, Object target, Method method) {
        this.name = name;
        this.target = target;
        this.method = method;

        List<ParameterDescriptor> params = new ArrayList<>();
        for (Parameter parameter : method.getParameters()) {
            params.add(new ParameterDescriptor(parameter));
        }
        this.parameters = Collections.unmodifiableList(params);

        Exposed exposed = method.getAnnotation(Exposed.class);
        this.doc = exposed != null && StringUtils.isNotEmpty(exposed.doc()) ? exposed.doc() : null;
    }

    public static MethodDescriptor of(String name, Object target, Method method) {
        try {
            method.setAccessible(true);
        } catch (RuntimeException e) {
            LOG.debug("Method {} is not made accessible, invocation relies on public access", method, e);
        }
        return new MethodDescriptor(name, target, method);
    }

    /**
     * Describes the exposable methods of {@code target}, walking its class hierarchy up to but excluding
     * {@code stopClass}. A method declared in a subclass wins over a superclass method of the same command name;
     * among overloads declared together the first in name, arity and parameter type order wins.
     */
    public static List<MethodDescriptor> describe(Object target, Class<?> stopClass) {
        Map<String, MethodDescriptor> descriptors = new LinkedHashMap<>();
        for (Class<?> clazz = target.getClass(); clazz != null && clazz != stopClass && clazz != Object.class;
            clazz = clazz.getSuperclass()) {
            Method[] methods = clazz.getDeclaredMethods();
            Arrays.sort(methods, METHOD_ORDER);
            for (Method method : methods) {
                if (!isExposable(method)) {
                    continue;
                }
                String command = commandName(method);
                if (!descriptors.containsKey(command)) {
                    descriptors.put(command, of(command, target, method));
                }
            }
        }
        return new ArrayList<>(descriptors.values());
    }

    static boolean isExposable(Method method) {
        int modifiers = method.getModifiers();
        return Modifier.isPublic(modifiers)
            && !Modifier.isStatic(modifiers)
            && !method.isBridge()
            && !method.isSynthetic()
            && !method.getName().startsWith("_")
            && !method.isAnnotationPresent(NotExposed.class);
    }

    static String commandName(Method method) {
        Exposed exposed = method.getAnnotation(Exposed.class);
        if (exposed != null && StringUtils.isNotEmpty(exposed.value())) {
            return exposed.value();
        }
        return method.getName();
    }

    /**
     * Binds {@code data} to the parameters and invokes the method.
     *
     * @return whatever the method returned, possibly a {@link java.util.concurrent.CompletionStage}
     * @throws IllegalArgumentException if a required parameter is missing or a value does not convert
     */
    public Object invoke(Object data) throws Exception {
        Object[] args = bind(data);
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    Object[] bind(Object data) {
        Object[] args = new Object[parameters.size()];
        if (data instanceof Map) {
            Map<?, ?> named = (Map<?, ?>) data;
            for (int i = 0; i < args.length; i++) {
                ParameterDescriptor parameter = parameters.get(i);
                if (named.containsKey(parameter.getName())) {
                    args[i] = parameter.convert(named.get(parameter.getName()));
                } else {
                    args[i] = parameter.missing(name);
                }
            }
        } else {
            for (int i = 0; i < args.length; i++) {
                ParameterDescriptor parameter = parameters.get(i);
                if (i == 0 && data != null) {
                    args[i] = parameter.convert(data);
                } else {
                    args[i] = parameter.missing(name);
                }
            }
        }
        return args;
    }

    /**
     * @return the entry reported for this command by {@code __get_methods__}
     */
    public Map<String, Object> toMetadata() {
        List<Map<String, Object>> params = new ArrayList<>();
        for (ParameterDescriptor parameter : parameters) {
            params.add(parameter.toMetadata());
        }
        Map<String, Object> returns = new LinkedHashMap<>();
        returns.put("type", method.getGenericReturnType().getTypeName());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("parameters", params);
        metadata.put("return", returns);
        metadata.put("doc", doc);
        return metadata;
    }

    public MethodInfo toMethodInfo() {
        List<ParameterInfo> params = new ArrayList<>();
        for (ParameterDescriptor parameter : parameters) {
            params.add(new ParameterInfo(parameter.getName(), parameter.isRequired(), parameter.getTypeName()));
        }
        return new MethodInfo(name, params, method.getGenericReturnType().getTypeName(), doc);
    }

    public String getName() {
        return name;
    }

    public Method getMethod() {
        return method;
    }

    public List<ParameterDescriptor> getParameters() {
        return parameters;
    }

    public String getDoc() {
        return doc;
    }

    @Override
    public String toString() {
        return "MethodDescriptor{name=" + name + ", method=" + method + '}';
    }

    public static final class ParameterDescriptor {
        private final String name;
        private final boolean required;
        private final Type type;
        private final Class<?> rawType;
        private final JavaType javaType;

        ParameterDescriptor(Parameter parameter) {
            Param param = parameter.getAnnotation(Param.class);
            this.name = param != null && StringUtils.isNotEmpty(param.value()) ? param.value() : parameter.getName();
            this.required = param == null || param.required();
            this.type = parameter.getParameterizedType();
            this.rawType = parameter.getType();
            this.javaType = ARGUMENT_MAPPER.getTypeFactory().constructType(type);
        }

        Object convert(Object value) {
            if (value == null) {
                return rawType.isPrimitive() ? defaultValue() : null;
            }
            if (!rawType.isPrimitive() && !javaType.hasGenericTypes() && rawType.isInstance(value)) {
                return value;
            }
            return ARGUMENT_MAPPER.convertValue(value, javaType);
        }

        Object missing(String command) {
            if (required) {
                throw new IllegalArgumentException(
                    String.format("%s() missing required argument '%s'", command, name));
            }
            return rawType.isPrimitive() ? defaultValue() : null;
        }

        private Object defaultValue() {
            return Array.get(Array.newInstance(rawType, 1), 0);
        }

        Map<String, Object> toMetadata() {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("name", name);
            metadata.put("required", required);
            metadata.put("type", getTypeName());
            return metadata;
        }

        public String getName() {
            return name;
        }

        public boolean isRequired() {
            return required;
        }

        public String getTypeName() {
            return type.getTypeName();
        }
    }
}
