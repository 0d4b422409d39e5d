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

package com.continuent.tungsten.binlog.mysql.event;

import com.continuent.tungsten.binlog.mysql.BinlogDecodeException;
import com.continuent.tungsten.binlog.mysql.MysqlBinlog;
import com.continuent.tungsten.binlog.mysql.conversion.LittleEndianConversion;

/**
 * Type specific metadata of one column of a table map event. Which accessors
 * are meaningful depends on {@link #getKind()}:
 * <ul>
 * <li>NONE: the type carries no metadata.</li>
 * <li>MAX_LENGTH: {@link #getMaxLength()} for VARCHAR, VAR_STRING, STRING and
 * the old DECIMAL.</li>
 * <li>LENGTH_SIZE: {@link #getLengthSize()}, number of bytes holding the
 * value length of BLOB, GEOMETRY and JSON columns, or the storage size of
 * FLOAT and DOUBLE.</li>
 * <li>DECIMAL: {@link #getPrecision()} and {@link #getDecimals()}.</li>
 * <li>BIT: {@link #getBits()} and {@link #getBytes()}.</li>
 * <li>ENUM_SET: {@link #getRealType()} and {@link #getSize()}, the number of
 * bytes used to store the value.</li>
 * <li>FRACTIONAL_SECONDS: {@link #getFractionalSecondsPrecision()}.</li>
 * </ul>
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class ColumnMetadata
{
    public enum Kind
    {
        NONE, MAX_LENGTH, LENGTH_SIZE, DECIMAL, BIT, ENUM_SET, FRACTIONAL_SECONDS
    }

    private final Kind kind;
    private final int  columnType;
    private final int  realType;
    private final int  first;
    private final int  second;
    private final int  length;

    private ColumnMetadata(Kind kind, int columnType, int realType, int first,
            int second, int length)
    {
        this.kind = kind;
        this.columnType = columnType;
        this.realType = realType;
        this.first = first;
        this.second = second;
        this.length = length;
    }

    /**
     * Decodes the metadata of a column of the given type.
     *
     * @param columnType Type code from the table map
     * @param buffer Metadata block
     * @param offset Offset of this column's metadata within the block
     * @throws BinlogDecodeException If the type is unknown or the block is
     *             too short
     */
    public static ColumnMetadata decode(int columnType, byte[] buffer,
            int offset) throws BinlogDecodeException
    {
        switch (columnType)
        {
            case MysqlBinlog.MYSQL_TYPE_TINY_BLOB :
            case MysqlBinlog.MYSQL_TYPE_BLOB :
            case MysqlBinlog.MYSQL_TYPE_MEDIUM_BLOB :
            case MysqlBinlog.MYSQL_TYPE_LONG_BLOB :
            case MysqlBinlog.MYSQL_TYPE_DOUBLE :
            case MysqlBinlog.MYSQL_TYPE_FLOAT :
            case MysqlBinlog.MYSQL_TYPE_GEOMETRY :
            case MysqlBinlog.MYSQL_TYPE_JSON :
                /* These types store a single byte */
                return new ColumnMetadata(Kind.LENGTH_SIZE, columnType,
                        columnType, LittleEndianConversion.convert1ByteToInt(
                                buffer, offset), 0, 1);

            case MysqlBinlog.MYSQL_TYPE_SET :
            case MysqlBinlog.MYSQL_TYPE_ENUM :
            case MysqlBinlog.MYSQL_TYPE_STRING :
            {
                /*
                 * The first byte holds the real type, the second the field
                 * size. For CHAR columns longer than 255 bytes, bits of the
                 * length are folded into the real type byte.
                 */
                int type = LittleEndianConversion.convert1ByteToInt(buffer,
                        offset);
                int size = LittleEndianConversion.convert1ByteToInt(buffer,
                        offset + 1);
                if (type == MysqlBinlog.MYSQL_TYPE_ENUM
                        || type == MysqlBinlog.MYSQL_TYPE_SET)
                    return new ColumnMetadata(Kind.ENUM_SET, columnType, type,
                            size, 0, 2);

                int metadata = (type << 8) + size;
                int maxLength = (((metadata >> 4) & 0x300) ^ 0x300)
                        + (metadata & 0x00ff);
                return new ColumnMetadata(Kind.MAX_LENGTH, columnType,
                        type | 0x30, maxLength, 0, 2);
            }

            case MysqlBinlog.MYSQL_TYPE_BIT :
            {
                int bits = LittleEndianConversion.convert1ByteToInt(buffer,
                        offset);
                int bytes = LittleEndianConversion.convert1ByteToInt(buffer,
                        offset + 1);
                int totalBits = bytes * 8 + bits;
                return new ColumnMetadata(Kind.BIT, columnType, columnType,
                        totalBits, (totalBits + 7) / 8, 2);
            }

            case MysqlBinlog.MYSQL_TYPE_VARCHAR :
            case MysqlBinlog.MYSQL_TYPE_VAR_STRING :
            case MysqlBinlog.MYSQL_TYPE_DECIMAL :
                /* These types store two bytes. */
                return new ColumnMetadata(Kind.MAX_LENGTH, columnType,
                        columnType, LittleEndianConversion.convert2BytesToInt(
                                buffer, offset), 0, 2);

            case MysqlBinlog.MYSQL_TYPE_NEWDECIMAL :
                return new ColumnMetadata(Kind.DECIMAL, columnType,
                        columnType, LittleEndianConversion.convert1ByteToInt(
                                buffer, offset),
                        LittleEndianConversion.convert1ByteToInt(buffer,
                                offset + 1), 2);

            case MysqlBinlog.MYSQL_TYPE_TIME2 :
            case MysqlBinlog.MYSQL_TYPE_TIMESTAMP2 :
            case MysqlBinlog.MYSQL_TYPE_DATETIME2 :
                return new ColumnMetadata(Kind.FRACTIONAL_SECONDS, columnType,
                        columnType, LittleEndianConversion.convert1ByteToInt(
                                buffer, offset), 0, 1);

            case MysqlBinlog.MYSQL_TYPE_DATE :
            case MysqlBinlog.MYSQL_TYPE_DATETIME :
            case MysqlBinlog.MYSQL_TYPE_TIMESTAMP :
            case MysqlBinlog.MYSQL_TYPE_TIME :
            case MysqlBinlog.MYSQL_TYPE_TINY :
            case MysqlBinlog.MYSQL_TYPE_SHORT :
            case MysqlBinlog.MYSQL_TYPE_INT24 :
            case MysqlBinlog.MYSQL_TYPE_LONG :
            case MysqlBinlog.MYSQL_TYPE_LONGLONG :
            case MysqlBinlog.MYSQL_TYPE_NULL :
            case MysqlBinlog.MYSQL_TYPE_YEAR :
            case MysqlBinlog.MYSQL_TYPE_NEWDATE :
                return new ColumnMetadata(Kind.NONE, columnType, columnType,
                        0, 0, 0);

            default :
                throw new BinlogDecodeException("Unknown column type "
                        + columnType + " in table map metadata");
        }
    }

    public Kind getKind()
    {
        return kind;
    }

    /** Type code as found in the table map. */
    public int getColumnType()
    {
        return columnType;
    }

    /**
     * Type the column really has. Differs from the column type for STRING
     * columns, which cover CHAR, ENUM and SET.
     */
    public int getRealType()
    {
        return realType;
    }

    /** Bytes of the metadata block used by this column. */
    public int getLength()
    {
        return length;
    }

    public int getMaxLength()
    {
        return kind == Kind.MAX_LENGTH ? first : 0;
    }

    public int getLengthSize()
    {
        return kind == Kind.LENGTH_SIZE ? first : 0;
    }

    public int getPrecision()
    {
        return kind == Kind.DECIMAL ? first : 0;
    }

    public int getDecimals()
    {
        return kind == Kind.DECIMAL ? second : 0;
    }

    public int getBits()
    {
        return kind == Kind.BIT ? first : 0;
    }

    public int getBytes()
    {
        return kind == Kind.BIT ? second : 0;
    }

    public int getSize()
    {
        return kind == Kind.ENUM_SET ? first : 0;
    }

    public int getFractionalSecondsPrecision()
    {
        return kind == Kind.FRACTIONAL_SECONDS ? first : 0;
    }

    public String toString()
    {
        switch (kind)
        {
            case MAX_LENGTH :
                return "max_length=" + first;
            case LENGTH_SIZE :
                return "length_size=" + first;
            case DECIMAL :
                return "precision=" + first + " decimals=" + second;
            case BIT :
                return "bits=" + first + " bytes=" + second;
            case ENUM_SET :
                return "real_type=" + realType + " size=" + first;
            case FRACTIONAL_SECONDS :
                return "fsp=" + first;
            default :
                return "none";
        }
    }
}
