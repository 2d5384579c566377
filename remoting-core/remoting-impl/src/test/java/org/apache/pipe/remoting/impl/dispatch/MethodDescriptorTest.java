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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.pipe.remoting.api.annotation.NotExposed;
import org.apache.pipe.remoting.api.annotation.Param;
import org.apache.pipe.remoting.api.command.MethodInfo;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MethodDescriptorTest {
    @Test
    public void describe_PublicInstanceMethodsOnly() {
        List<String> names = names(MethodDescriptor.describe(new Child(), Object.class));

        assertThat(names).containsExactly("overridden", "scale", "inherited");
    }

    @Test
    public void describe_StopsAtGivenClass() {
        List<String> names = names(MethodDescriptor.describe(new Child(), Parent.class));

        assertThat(names).containsExactly("overridden", "scale");
    }

    @Test
    public void describe_SubclassOverrideWins() throws Exception {
        MethodDescriptor overridden = find(MethodDescriptor.describe(new Child(), Object.class), "overridden");

        assertThat(overridden.getMethod().getDeclaringClass()).isEqualTo(Child.class);
        assertThat(overridden.invoke(null)).isEqualTo("child");
    }

    @Test
    public void invoke_ConvertsNamedArguments() throws Exception {
        MethodDescriptor scale = find(MethodDescriptor.describe(new Child(), Object.class), "scale");
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("values", Arrays.asList(1, 2));
        args.put("factor", "3");

        assertThat(scale.invoke(args)).isEqualTo(Arrays.asList(3L, 6L));
    }

    @Test
    public void invoke_OptionalPrimitiveDefaultsToZero() throws Exception {
        MethodDescriptor scale = find(MethodDescriptor.describe(new Child(), Object.class), "scale");

        assertThat(scale.invoke(Collections.singletonMap("values", Arrays.asList(5)))).isEqualTo(Arrays.asList(0L));
    }

    @Test
    public void invoke_PositionalData() throws Exception {
        MethodDescriptor scale = find(MethodDescriptor.describe(new Child(), Object.class), "scale");

        assertThat(scale.invoke(Arrays.asList(4))).isEqualTo(Arrays.asList(0L));
    }

    @Test
    public void invoke_MissingRequiredArgument() {
        final MethodDescriptor scale = find(MethodDescriptor.describe(new Child(), Object.class), "scale");

        assertThatThrownBy(new ThrowingCallable() {
            @Override
            public void call() throws Throwable {
                scale.invoke(null);
            }
        }).isInstanceOf(IllegalArgumentException.class).hasMessage("scale() missing required argument 'values'");
    }

    @Test
    public void invoke_UnwrapsTargetException() {
        final MethodDescriptor inherited = find(MethodDescriptor.describe(new Child(), Object.class), "inherited");

        assertThatThrownBy(new ThrowingCallable() {
            @Override
            public void call() throws Throwable {
                inherited.invoke("boom");
            }
        }).isInstanceOf(UnsupportedOperationException.class).hasMessage("boom");
    }

    @Test
    public void toMethodInfo_ReportsParameters() {
        MethodInfo info = find(MethodDescriptor.describe(new Child(), Object.class), "scale").toMethodInfo();

        assertThat(info.getParameters()).hasSize(2);
        assertThat(info.getParameters().get(0).isRequired()).isTrue();
        assertThat(info.getParameters().get(1).isRequired()).isFalse();
        assertThat(info.getReturnType()).isEqualTo("java.util.List<java.lang.Long>");
        assertThat(info.getDoc()).isNull();
    }

    private static List<String> names(List<MethodDescriptor> descriptors) {
        List<String> names = new ArrayList<>();
        for (MethodDescriptor descriptor : descriptors) {
            names.add(descriptor.getName());
        }
        return names;
    }

    private static MethodDescriptor find(List<MethodDescriptor> descriptors, String name) {
        for (MethodDescriptor descriptor : descriptors) {
            if (descriptor.getName().equals(name)) {
                return descriptor;
            }
        }
        throw new AssertionError("No descriptor " + name);
    }

    public static class Parent {
        public String overridden() {
            return "parent";
        }

        public String inherited(String message) {
            throw new UnsupportedOperationException(message);
        }
    }

    public static class Child extends Parent {
        @Override
        public String overridden() {
            return "child";
        }

        public List<Long> scale(@Param("values") List<Long> values,
            @Param(value = "factor", required = false) int factor) {
            List<Long> scaled = new ArrayList<>();
            for (Long value : values) {
                scaled.add(value * factor);
            }
            return scaled;
        }

        @NotExposed
        public void internal() {
        }

        public void _private() {
        }

        public static String helper() {
            return "static";
        }

        protected String notPublic() {
            return "protected";
        }
    }
}
