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
 * Event body once its size has been checked and its checksum, if any,
 * verified and removed.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class ValidatedBody
{
    private final byte[] body;
    private final int    checksumAlgorithm;
    private final long   checksum;

    public ValidatedBody(byte[] body, int checksumAlgorithm, long checksum)
    {
        this.body = body;
        this.checksumAlgorithm = checksumAlgorithm;
        this.checksum = checksum;
    }

    /** Body bytes without checksum. */
    public byte[] getBody()
    {
        return body;
    }

    public int getChecksumAlgorithm()
    {
        return checksumAlgorithm;
    }

    /** Checksum found in the event, or -1 if there was none. */
    public long getChecksum()
    {
        return checksum;
    }
}
