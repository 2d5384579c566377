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

/**
 * This package contains the pipe transport and the dispatch server built on it.
 *
 * Remoting wire-format protocol description:
 *
 * <pre>
 * 1.Payload Length                            4 byte, big-endian unsigned, excludes itself
 * 2.Payload                                   variant length, one codec-encoded envelope
 *
 * Envelopes, MessagePack maps by default:
 *   command   {"command": name, "data": value, "request_id": id}, request_id absent for one-way commands
 *   response  {"result": value, "request_id": id}, or the handler's own map tagged with "request_id"
 *   error     {"error": message, "traceback": detail, "request_id": id}
 *
 * A request id carries the prefix of the side that issued it, which tells a response from a command.
 * </pre>
 */
package org.apache.pipe.remoting;
