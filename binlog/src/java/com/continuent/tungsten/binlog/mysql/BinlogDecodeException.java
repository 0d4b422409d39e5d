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

import com.continuent.tungsten.binlog.BinlogException;

/**
 * Signals that a binary log could not be decoded. The position is the absolute
 * offset in the stream of the event being decoded, or -1 when it is not known
 * at the point where the error is detected.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 * @version 1.0
 */
public class BinlogDecodeException extends BinlogException
{
    private static final long serialVersionUID = 1L;
    private long              position         = -1;

    public BinlogDecodeException(String msg)
    {
        super(msg);
    }

    public BinlogDecodeException(String msg, Throwable cause)
    {
        super(msg, cause);
    }

    /**
     * Returns the stream offset of the failing event or -1 if unknown.
     */
    public long getPosition()
    {
        return position;
    }

    /**
     * Sets the stream offset once it becomes known to the caller.
     */
    public void setPosition(long position)
    {
        this.position = position;
    }

    /**
     * {@inheritDoc}
     *
     * @see java.lang.Throwable#getMessage()
     */
    @Override
    public String getMessage()
    {
        if (position < 0)
            return super.getMessage();
        return super.getMessage() + " (position=" + position + ")";
    }
}
