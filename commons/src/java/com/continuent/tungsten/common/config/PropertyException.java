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

package com.continuent.tungsten.common.config;

/**
 * Signals a property that is missing, cannot be converted to the type its
 * consumer expects or cannot be applied to a target object.
 *
 * @author <a href="mailto:robert.hodges@continuent.com">Robert Hodges</a>
 * @version 1.0
 */
public class PropertyException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private final String      key;

    /**
     * Creates a new exception with a message.
     */
    public PropertyException(String msg)
    {
        this(msg, null, null);
    }

    /**
     * Creates a new exception with a message and underlying exception.
     */
    public PropertyException(String msg, Throwable t)
    {
        this(msg, null, t);
    }

    /**
     * Creates a new exception naming the property at fault.
     *
     * @param msg Error message
     * @param key Property name, or null if the error is not about one property
     * @param t Underlying exception or null
     */
    public PropertyException(String msg, String key, Throwable t)
    {
        super(msg, t);
        this.key = key;
    }

    /** Returns the name of the offending property, if known. */
    public String getKey()
    {
        return key;
    }
}
