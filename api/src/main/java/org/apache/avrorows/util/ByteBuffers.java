/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.avrorows.util;

import java.nio.ByteBuffer;

public class ByteBuffers {

  /**
   * Copies the remaining bytes of a buffer into a new array.
   *
   * <p>The buffer's position is not changed and the returned array is never shared with the
   * buffer.
   */
  public static byte[] copyToByteArray(ByteBuffer buffer) {
    if (buffer == null) {
      return null;
    }

    byte[] bytes = new byte[buffer.remaining()];
    buffer.asReadOnlyBuffer().get(bytes);
    return bytes;
  }

  public static ByteBuffer copy(ByteBuffer buffer) {
    if (buffer == null) {
      return null;
    }

    return ByteBuffer.wrap(copyToByteArray(buffer));
  }

  /** Returns a read-only buffer over a private copy of the remaining bytes of a buffer. */
  public static ByteBuffer readOnlyCopy(ByteBuffer buffer) {
    if (buffer == null) {
      return null;
    }

    return copy(buffer).asReadOnlyBuffer();
  }

  private ByteBuffers() {}
}
