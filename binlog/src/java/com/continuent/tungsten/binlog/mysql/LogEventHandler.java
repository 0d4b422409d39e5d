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
 * Receives the events of a binlog walk.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public interface LogEventHandler
{
    /**
     * Handles one event. The event is only valid during the call.
     *
     * @return true to go on with the next event, false to end the walk
     * @throws BinlogException To end the walk with an error
     */
    public boolean handle(LogEvent event) throws BinlogException;
}
