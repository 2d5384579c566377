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

package org.apache.pipe.remoting.config;

/**
 * How the dispatch server pulls frames off the input stream without blocking its scheduler thread.
 */
public enum ReadMode {
    /**
     * Every poll iteration hands one blocking receive to the reader executor.
     */
    PER_POLL,
    /**
     * A single long-lived reader thread receives continuously and queues the frames for the scheduler.
     */
    CONTINUOUS
}
