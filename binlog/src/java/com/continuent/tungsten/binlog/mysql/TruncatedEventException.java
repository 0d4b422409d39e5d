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
 * Initial developer(s): Stephane Giron
 * Contributor(s):
 */

package com.continuent.tungsten.binlog.mysql;

/**
 * Raised when an event or a field inside it ends before the bytes it needs.
 * Truncation is never recoverable as event boundaries are lost with it.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 * @version 1.0
 */
public class TruncatedEventException extends BinlogDecodeException
{
    private static final long serialVersionUID = 1L;
    private final int         expected;
    private final int         available;

    public TruncatedEventException(String msg, int expected, int available)
    {
        super(msg + " (expected=" + expected + " available=" + available
                + ")");
        this.expected = expected;
        this.available = available;
    }

    /** Number of bytes that were needed. */
    public int getExpected()
    {
        return expected;
    }

    /** Number of bytes that were actually left. */
    public int getAvailable()
    {
        return available;
    }
}
