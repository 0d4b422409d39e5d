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
 * Contributor(s): Gilles Rayrat, Stephane Giron
 */

package com.continuent.tungsten.common.config;

import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.log4j.Logger;

/**
 * Defines a simple map wrapper that stores and retrieves properties as
 * strings. Properties may be loaded from a string of name/value pairs and
 * pushed onto Java objects through their setter methods, which is how
 * components pick up their configuration.
 *
 * @author <a href="mailto:robert.hodges@continuent.com">Robert Hodges</a>
 * @version 1.0
 */
public class TungstenProperties
{
    private static Logger         logger = Logger.getLogger(TungstenProperties.class);

    protected Map<String, String> properties;

    /**
     * Creates a new, empty instance.
     */
    public TungstenProperties()
    {
        properties = new HashMap<String, String>();
    }

    /**
     * Loads values from a string of name-value pairs of the form
     * a=1;b=2;...;z=N. White space around names and values is ignored and
     * pairs with an empty name are dropped. Current values are replaced.
     */
    public void load(String nameValuePairs)
    {
        HashMap<String, String> map = new HashMap<String, String>();
        for (String pair : nameValuePairs.split(";"))
        {
            int equals = pair.indexOf('=');
            String key;
            String value;
            if (equals < 0)
            {
                key = pair.trim();
                value = "";
            }
            else
            {
                key = pair.substring(0, equals).trim();
                value = pair.substring(equals + 1).trim();
            }
            if (key.length() > 0)
                map.put(key, value);
        }
        properties = map;
    }

    /**
     * Applies each property to the setter of the same name on a Java object.
     * The setter name is derived from the property name by capitalizing the
     * first letter and each letter after an underscore, dropping the
     * underscores and prefixing "set", so start_position becomes
     * setStartPosition. The setter must be public and take a single argument
     * of a primitive type, its wrapper or String.
     *
     * @param o Instance for which we are to set properties
     * @throws PropertyException Thrown if a setter is missing, the value
     *             cannot be converted or the setter fails
     */
    public void applyProperties(Object o)
    {
        Method[] methods = o.getClass().getMethods();
        for (String key : new TreeSet<String>(keyNames()))
        {
            String setterName = setterName(key);
            Method setter = null;
            for (Method m : methods)
            {
                if (m.getName().equals(setterName)
                        && m.getParameterTypes().length == 1)
                {
                    setter = m;
                    break;
                }
            }

            if (setter == null)
                throw new PropertyException(
                        "Unable to find method corresponding to property:"
                                + " class=" + o.getClass().getName()
                                + " property=" + key + " expected setter="
                                + setterName, key, null);

            String value = getString(key);
            if (value == null)
                continue;
            Object arg = convert(key, value, setter.getParameterTypes()[0]);

            try
            {
                setter.invoke(o, arg);
                if (logger.isDebugEnabled())
                    logger.debug("Set attribute in object=<"
                            + o.getClass().getSimpleName() + "> from key <"
                            + key + ">");
            }
            catch (Exception e)
            {
                throw new PropertyException("Unable to set property: key="
                        + key + " value=" + value, key, e);
            }
        }
    }

    /**
     * Returns the setter name for a property, e.g. setBufferSize for
     * buffer_size. A trailing underscore is kept.
     */
    public static String setterName(String key)
    {
        StringBuilder name = new StringBuilder("set");
        boolean upper = true;
        for (int i = 0; i < key.length(); i++)
        {
            char c = key.charAt(i);
            if (c == '_' && i < key.length() - 1)
                upper = true;
            else if (upper)
            {
                name.append(Character.toUpperCase(c));
                upper = false;
            }
            else
                name.append(c);
        }
        return name.toString();
    }

    // Converts a value to the type of a setter argument.
    private Object convert(String key, String value, Class<?> type)
    {
        try
        {
            if (type == String.class)
                return value;
            else if (type == Integer.TYPE || type == Integer.class)
                return Integer.valueOf(value.trim());
            else if (type == Long.TYPE || type == Long.class)
                return Long.valueOf(value.trim());
            else if (type == Boolean.TYPE || type == Boolean.class)
                return Boolean.valueOf(value.trim());
            else if (type == Double.TYPE || type == Double.class)
                return Double.valueOf(value.trim());
            else if ((type == Character.TYPE || type == Character.class)
                    && value.length() == 1)
                return Character.valueOf(value.charAt(0));
        }
        catch (NumberFormatException e)
        {
            throw new PropertyException("Unable to translate property value: key="
                    + key + " value=" + value, key, e);
        }
        throw new PropertyException("Unsupported property type: key=" + key
                + " type=" + type.getName() + " value=" + value, key, null);
    }

    /**
     * Returns keys of all properties currently stored in this instance.
     */
    public Set<String> keyNames()
    {
        return properties.keySet();
    }

    public int size()
    {
        return properties.size();
    }

    public void setString(String key, String value)
    {
        properties.put(key, value);
    }

    public void setInt(String key, int value)
    {
        properties.put(key, Integer.toString(value));
    }

    public void setLong(String key, long value)
    {
        properties.put(key, Long.toString(value));
    }

    public void setBoolean(String key, boolean value)
    {
        properties.put(key, Boolean.toString(value));
    }

    /**
     * Returns the value as a String or null if not found.
     */
    public String getString(String key)
    {
        return properties.get(key);
    }

    /**
     * Returns a TungstenProperties instance holding the properties whose names
     * match the given prefix.
     *
     * @param prefix Return only those properties that match the prefix
     * @param removePrefix If true remove the prefix from each property name
     */
    public TungstenProperties subset(String prefix, boolean removePrefix)
    {
        TungstenProperties tp = new TungstenProperties();
        for (String key : properties.keySet())
        {
            if (!key.startsWith(prefix))
                continue;
            String newKey = removePrefix ? key.substring(prefix.length()) : key;
            if (newKey.length() > 0)
                tp.setString(newKey, properties.get(key));
        }
        return tp;
    }

    /**
     * Returns the properties sorted by name, one per line.
     */
    public String toString()
    {
        StringBuilder builder = new StringBuilder("{\n");
        for (Map.Entry<String, String> entry : new TreeMap<String, String>(
                properties).entrySet())
        {
            builder.append("  ").append(entry.getKey()).append('=')
                    .append(entry.getValue()).append('\n');
        }
        return builder.append('}').toString();
    }
}
