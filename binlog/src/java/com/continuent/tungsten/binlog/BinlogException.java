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
 * Initial developer(s): Alex Yurchenko
 * Contributor(s): Stephane Giron
 */

package com.continuent.tungsten.binlog;

/**
 * This class defines a BinlogException, the parent of all checked exceptions
 * raised while reading and decoding binary logs.
 *
 * @author <a href="mailto:alexey.yurchenko@continuent.com">Alex Yurchenko</a>
 * @version 1.0
 */
public class BinlogException extends Exception
{
    private static final long serialVersionUID     = 1L;

    private String            originalErrorMessage = null;

    /**
     * Creates a new <code>BinlogException</code> object
     *
     * @param msg
     */
    public BinlogException(String msg)
    {
        super(msg);
    }

    /**
     * Creates a new <code>BinlogException</code> object
     *
     * @param cause
     */
    public BinlogException(Throwable cause)
    {
        super(cause);
        if (cause instanceof BinlogException)
            this.originalErrorMessage = ((BinlogException) cause).originalErrorMessage;
    }

    /**
     * Creates a new <code>BinlogException</code> object
     *
     * @param msg
     * @param cause
     */
    public BinlogException(String msg, Throwable cause)
    {
        super(msg, cause);
        if (cause instanceof BinlogException)
            this.originalErrorMessage = ((BinlogException) cause).originalErrorMessage;
        else
            this.originalErrorMessage = msg;
    }

    /**
     * Returns the message of the innermost binlog exception in the chain, which
     * is usually the most specific description of what went wrong.
     */
    public String getOriginalErrorMessage()
    {
        if (originalErrorMessage == null)
            return getMessage();
        return originalErrorMessage;
    }
}
