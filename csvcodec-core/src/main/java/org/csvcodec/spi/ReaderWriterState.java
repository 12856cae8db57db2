/*
 * Copyright 2013 Cloudera Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.csvcodec.spi;

/**
 * <p>
 * A set of states for readers and writers.
 * </p>
 * <p>
 * A reader or writer starts {@code NEW}, becomes {@code OPEN} once initialized,
 * and ends {@code CLOSED}. A session that raised a fatal error moves to
 * {@code ERROR} and refuses further calls.
 * </p>
 */
public enum ReaderWriterState {
  NEW, OPEN, CLOSED, ERROR
}
