/**
 * VMware Continuent Tungsten Replicator
 * Copyright (C) 2015 VMware, Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Initial developer(s): Robert Hodges
 * Contributor(s): Stephane Giron
 */

package com.continuent.tungsten.binlog.mysql;

import java.io.IOException;

/**
 * Sequential source of binlog bytes. Reads either return exactly the number
 * of bytes asked for or report that the stream ended.
 *
 * @author <a href="mailto:robert.hodges@continuent.com">Robert Hodges</a>
 */
public interface BinlogSource
{
    /**
     * Reads exactly length bytes.
     *
     * @param length Number of bytes to read
     * @return The bytes, an empty array if length is 0, or null if the stream
     *         ended before the first byte
     * @throws TruncatedEventException If the stream ended after some but not
     *             all of the bytes
     * @throws IOException If the underlying stream fails
     * @throws InterruptedException If the reading thread is interrupted
     */
    public byte[] readExactly(int length) throws TruncatedEventException,
            IOException, InterruptedException;

    /** Returns the number of bytes read so far. */
    public long getOffset();

    /** Releases the underlying stream. */
    public void close();
}
