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
 * Raised when a query event holds a status variable key whose length is not
 * known, which makes the remaining status variables unreadable.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 * @version 1.0
 */
public class UnknownStatusVariableException extends BinlogDecodeException
{
    private static final long serialVersionUID = 1L;
    private final int         key;

    public UnknownStatusVariableException(int key, int offset)
    {
        super("Unknown query status variable " + key + " at offset " + offset);
        this.key = key;
    }

    public int getKey()
    {
        return key;
    }
}
