/*
 * SyntaxConverters.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of arbor, a directory entry and query modelling library.
 *
 * arbor is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * arbor is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with arbor.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.arbor.schema;

import java.text.MessageFormat;
import java.util.Calendar;
import java.util.Date;
import java.util.Map;
import java.util.TimeZone;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A table of syntax converters keyed by syntax OID.
 *
 * <p>The Boolean, Integer and Generalized Time syntaxes are registered by
 * default. Values of any other syntax are returned unchanged. A value
 * that a converter rejects is logged and returned as the raw string.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SyntaxConverters {

    private static final Logger LOGGER = Logger.getLogger(SyntaxConverters.class.getName());

    public static final String BOOLEAN = "1.3.6.1.4.1.1466.115.121.1.7";
    public static final String GENERALIZED_TIME = "1.3.6.1.4.1.1466.115.121.1.24";
    public static final String INTEGER = "1.3.6.1.4.1.1466.115.121.1.27";

    // yyyyMMddHH[mm[ss]][(.|,)fraction](Z|(+|-)HH[mm])
    private static final Pattern GENERALIZED_TIME_PATTERN = Pattern.compile(
            "(\\d{4})(\\d{2})(\\d{2})(\\d{2})(\\d{2})?(\\d{2})?(?:[.,](\\d+))?(Z|[+-]\\d{2}(?:\\d{2})?)");

    private final Map<String, SyntaxConverter> converters =
            new ConcurrentHashMap<String, SyntaxConverter>();

    /**
     * Creates a table with the default converters.
     */
    public SyntaxConverters() {
        register(BOOLEAN, new SyntaxConverter() {
            @Override
            public Object convert(String value) {
                return Boolean.valueOf(parseBoolean(value));
            }
        });
        register(INTEGER, new SyntaxConverter() {
            @Override
            public Object convert(String value) {
                return Long.valueOf(value.trim());
            }
        });
        register(GENERALIZED_TIME, new SyntaxConverter() {
            @Override
            public Object convert(String value) {
                return parseGeneralizedTime(value);
            }
        });
    }

    /**
     * Registers a converter, replacing any previous one for the syntax.
     *
     * @param syntaxOID the numeric syntax OID
     * @param converter the converter
     */
    public void register(String syntaxOID, SyntaxConverter converter) {
        if (syntaxOID == null || converter == null) {
            throw new NullPointerException();
        }
        converters.put(syntaxOID, converter);
    }

    /**
     * Returns the converter for a syntax.
     *
     * @param syntaxOID the numeric syntax OID
     * @return the converter, or null if values are kept as strings
     */
    public SyntaxConverter getConverter(String syntaxOID) {
        return syntaxOID == null ? null : converters.get(syntaxOID);
    }

    /**
     * Converts a raw value according to its syntax.
     *
     * @param syntaxOID the syntax OID (may be null)
     * @param value the raw value
     * @return the converted value, or the raw value if no converter applies
     */
    public Object convert(String syntaxOID, String value) {
        if (value == null) {
            return null;
        }
        SyntaxConverter converter = getConverter(syntaxOID);
        if (converter == null) {
            return value;
        }
        try {
            return converter.convert(value);
        } catch (IllegalArgumentException e) {
            if (LOGGER.isLoggable(Level.WARNING)) {
                String message = Schema.L10N.getString("warn.syntax_conversion");
                LOGGER.log(Level.WARNING, MessageFormat.format(message, value, syntaxOID), e);
            }
            return value;
        }
    }

    static boolean parseBoolean(String value) {
        String s = value.trim();
        if ("TRUE".equalsIgnoreCase(s)) {
            return true;
        } else if ("FALSE".equalsIgnoreCase(s)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid Boolean: " + value);
    }

    /**
     * Parses an RFC 4517 GeneralizedTime value.
     *
     * @param value the value, e.g. {@code 20250114093000Z}
     * @return the date
     * @throws IllegalArgumentException if the value is malformed
     */
    public static Date parseGeneralizedTime(String value) {
        Matcher m = GENERALIZED_TIME_PATTERN.matcher(value.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid GeneralizedTime: " + value);
        }
        String zone = m.group(8);
        TimeZone tz = TimeZone.getTimeZone("Z".equals(zone) ? "GMT" : "GMT" + zone);
        Calendar cal = Calendar.getInstance(tz);
        cal.clear();
        cal.setLenient(false);
        cal.set(Calendar.YEAR, Integer.parseInt(m.group(1)));
        cal.set(Calendar.MONTH, Integer.parseInt(m.group(2)) - 1);
        cal.set(Calendar.DAY_OF_MONTH, Integer.parseInt(m.group(3)));
        cal.set(Calendar.HOUR_OF_DAY, Integer.parseInt(m.group(4)));
        int minutes = m.group(5) != null ? Integer.parseInt(m.group(5)) : 0;
        int seconds = m.group(6) != null ? Integer.parseInt(m.group(6)) : 0;
        cal.set(Calendar.MINUTE, minutes);
        cal.set(Calendar.SECOND, seconds);
        long millis;
        try {
            millis = cal.getTimeInMillis();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid GeneralizedTime: " + value, e);
        }
        String fraction = m.group(7);
        if (fraction != null) {
            // the fraction applies to the least significant unit present
            double f = Double.parseDouble("0." + fraction);
            long unit = m.group(6) != null ? 1000L : m.group(5) != null ? 60000L : 3600000L;
            millis += Math.round(f * unit);
        }
        return new Date(millis);
    }
}
