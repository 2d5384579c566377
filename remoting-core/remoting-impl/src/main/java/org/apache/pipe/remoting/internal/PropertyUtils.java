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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.apache.pipe.remoting.api.exception.RemotingRuntimeException;

public final class PropertyUtils {
    private PropertyUtils() {
    }

    /**
     * Loads properties from a file path, falling back to a classpath resource of the same name.
     */
    public static Properties loadProps(final String fileName) {
        File file = new File(fileName);
        try (InputStream in = file.isFile() ? new FileInputStream(file)
            : PropertyUtils.class.getClassLoader().getResourceAsStream(fileName)) {
            if (in == null) {
                throw new RemotingRuntimeException("Cannot find config " + fileName);
            }
            Properties properties = new Properties();
            properties.load(in);
            return properties;
        } catch (IOException e) {
            throw new RemotingRuntimeException("Cannot load config " + fileName, e);
        }
    }
}
