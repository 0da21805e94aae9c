/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.lib;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.relsig.errors.ConfigInvalidException;
import org.relsig.internal.RelSigText;
import org.relsig.util.StringUtils;

/**
 * Git style configuration text.
 * <p>
 * Holds the parsed lines of a configuration in the format used by
 * {@code git config}:
 *
 * <pre>
 * [section]
 * 	key = value
 * [section "subsection"]
 * 	key = "quoted value" # comment
 * </pre>
 *
 * Section and key names are case-insensitive, subsection names are not. If a
 * key occurs more than once, the last occurrence wins. Instances are safe to
 * read from multiple threads; {@link #fromText(String)} replaces the content
 * atomically.
 */
public class Config {

	/*
	 * Marker for a key that appears without "=". Compared by identity, so it
	 * must not be interned.
	 */
	private static final String MISSING_ENTRY = new String();

	private volatile List<ConfigLine> entries = Collections.emptyList();

	/**
	 * Check if a given string is the "missing" value.
	 *
	 * @param value
	 *            string to be checked
	 * @return true if the given string is the "missing" value
	 */
	public static boolean isMissing(String value) {
		return value == MISSING_ENTRY;
	}

	/**
	 * Get a string value.
	 *
	 * @param section
	 *            the section
	 * @param subsection
	 *            the subsection, or {@code null}
	 * @param name
	 *            the key name
	 * @return the value, or {@code null} if not set
	 */
	public String getString(String section, String subsection, String name) {
		String result = null;
		for (ConfigLine e : entries) {
			if (e.name != null && e.match(section, subsection, name)) {
				result = e.value;
			}
		}
		return result;
	}

	/**
	 * Get a boolean value.
	 * <p>
	 * A key without a value ({@code [signing] includeDefault}) is true.
	 *
	 * @param section
	 *            the section
	 * @param subsection
	 *            the subsection, or {@code null}
	 * @param name
	 *            the key name
	 * @param defaultValue
	 *            returned if the key is not set
	 * @return the value, or {@code defaultValue}
	 * @throws IllegalArgumentException
	 *             if the value is not a boolean
	 */
	public boolean getBoolean(String section, String subsection, String name,
			boolean defaultValue) {
		String value = getString(section, subsection, name);
		if (value == null) {
			return defaultValue;
		}
		if (isMissing(value)) {
			return true;
		}
		Boolean bool = StringUtils.toBooleanOrNull(value);
		if (bool == null) {
			throw new IllegalArgumentException(MessageFormat.format(
					RelSigText.get().invalidBooleanValue, section, name,
					value));
		}
		return bool.booleanValue();
	}

	/**
	 * Parse an enumeration value.
	 * <p>
	 * Values of enumerations implementing {@link ConfigEnum} are matched
	 * through {@link ConfigEnum#matchConfigValue(String)} first. Otherwise the
	 * constant name is compared ignoring case, treating {@code '-'} and
	 * {@code ' '} like {@code '_'}.
	 *
	 * @param all
	 *            all possible values, typically {@code EnumType.values()}
	 * @param section
	 *            the section
	 * @param subsection
	 *            the subsection, or {@code null}
	 * @param name
	 *            the key name
	 * @param defaultValue
	 *            returned if the key is not set; may be {@code null}
	 * @return the selected value, or {@code defaultValue}
	 * @throws IllegalArgumentException
	 *             if the value matches none of {@code all}
	 */
	public <T extends Enum<?>> T getEnum(T[] all, String section,
			String subsection, String name, T defaultValue) {
		String value = getString(section, subsection, name);
		if (value == null) {
			return defaultValue;
		}
		for (T t : all) {
			if (t instanceof ConfigEnum
					&& ((ConfigEnum) t).matchConfigValue(value)) {
				return t;
			}
		}
		String n = value.replace(' ', '_').replace('-', '_');
		for (T t : all) {
			if (StringUtils.equalsIgnoreCase(t.name(), n)) {
				return t;
			}
		}
		if (subsection != null) {
			throw new IllegalArgumentException(MessageFormat.format(
					RelSigText.get().enumValueNotSupported3, section,
					subsection, name, value));
		}
		throw new IllegalArgumentException(
				MessageFormat.format(RelSigText.get().enumValueNotSupported2,
						section, name, value));
	}

	/**
	 * Get the subsections of a section.
	 *
	 * @param section
	 *            the section
	 * @return the subsection names in order of first appearance
	 */
	public Set<String> getSubsections(String section) {
		Set<String> result = new LinkedHashSet<>();
		for (ConfigLine e : entries) {
			if (e.subsection != null
					&& StringUtils.equalsIgnoreCase(e.section, section)) {
				result.add(e.subsection);
			}
		}
		return Collections.unmodifiableSet(result);
	}

	/**
	 * Get the sections defined in this configuration.
	 *
	 * @return the lower-cased section names in order of first appearance
	 */
	public Set<String> getSections() {
		Set<String> result = new LinkedHashSet<>();
		for (ConfigLine e : entries) {
			if (e.section != null) {
				result.add(StringUtils.toLowerCase(e.section));
			}
		}
		return Collections.unmodifiableSet(result);
	}

	/**
	 * Get the keys set in a section.
	 *
	 * @param section
	 *            the section
	 * @param subsection
	 *            the subsection, or {@code null}
	 * @return the lower-cased key names in order of first appearance
	 */
	public Set<String> getNames(String section, String subsection) {
		Set<String> result = new LinkedHashSet<>();
		for (ConfigLine e : entries) {
			if (e.name != null && e.match(section, subsection)) {
				result.add(StringUtils.toLowerCase(e.name));
			}
		}
		return Collections.unmodifiableSet(result);
	}

	/**
	 * Tells whether this configuration has no entries at all.
	 *
	 * @return {@code true} if no section is defined
	 */
	public boolean isEmpty() {
		return getSections().isEmpty();
	}

	/**
	 * Drop all entries.
	 */
	protected void clear() {
		entries = Collections.emptyList();
	}

	/**
	 * Clear this configuration and reset to the contents of the parsed text.
	 *
	 * @param text
	 *            configuration text in git style
	 * @throws ConfigInvalidException
	 *             if the text is not formatted correctly; {@code this} is left
	 *             unchanged in that case
	 */
	public void fromText(String text) throws ConfigInvalidException {
		List<ConfigLine> result = new ArrayList<>();
		StringReader in = new StringReader(text);
		ConfigLine last = null;
		ConfigLine e = new ConfigLine();
		boolean skipToEol = false;
		for (;;) {
			int input = in.read();
			if (input < 0) {
				if (e.section != null) {
					result.add(e);
				}
				break;
			}
			char c = (char) input;
			if ('\n' == c) {
				if (e.section != null) {
					result.add(e);
					last = e;
				}
				e = new ConfigLine();
				skipToEol = false;
			} else if (skipToEol) {
				continue;
			} else if (';' == c || '#' == c) {
				skipToEol = true;
			} else if (e.section == null && Character.isWhitespace(c)) {
				continue;
			} else if ('[' == c) {
				e.section = readSectionName(in);
				input = in.read();
				if ('"' == input) {
					e.subsection = readSubsectionName(in);
					input = in.read();
				}
				if (']' != input) {
					throw new ConfigInvalidException(
							RelSigText.get().badGroupHeader);
				}
				// Anything after the header on the same line is ignored.
				skipToEol = true;
			} else if (last != null) {
				e.section = last.section;
				e.subsection = last.subsection;
				in.reset();
				e.name = readKeyName(in);
				if (e.name.endsWith("\n")) { //$NON-NLS-1$
					e.name = e.name.substring(0, e.name.length() - 1);
					e.value = MISSING_ENTRY;
				} else {
					e.value = readValue(in);
				}
			} else {
				throw new ConfigInvalidException(
						RelSigText.get().invalidLineInConfigFile);
			}
		}
		entries = Collections.unmodifiableList(result);
	}

	private static String readSectionName(StringReader in)
			throws ConfigInvalidException {
		StringBuilder name = new StringBuilder();
		for (;;) {
			int c = in.read();
			if (c < 0) {
				throw new ConfigInvalidException(
						RelSigText.get().unexpectedEndOfConfigFile);
			}
			if (']' == c) {
				in.reset();
				break;
			}
			if (' ' == c || '\t' == c) {
				// Only blanks may separate the name from a subsection.
				for (;;) {
					c = in.read();
					if (c < 0) {
						throw new ConfigInvalidException(
								RelSigText.get().unexpectedEndOfConfigFile);
					}
					if ('"' == c) {
						in.reset();
						break;
					}
					if (' ' != c && '\t' != c) {
						throw new ConfigInvalidException(MessageFormat.format(
								RelSigText.get().badSectionEntry, name));
					}
				}
				break;
			}
			if (Character.isLetterOrDigit((char) c) || '.' == c || '-' == c) {
				name.append((char) c);
			} else {
				throw new ConfigInvalidException(MessageFormat
						.format(RelSigText.get().badSectionEntry, name));
			}
		}
		return name.toString();
	}

	private static String readSubsectionName(StringReader in)
			throws ConfigInvalidException {
		StringBuilder r = new StringBuilder();
		for (;;) {
			int c = in.read();
			if (c < 0 || '"' == c) {
				break;
			}
			if ('\n' == c) {
				throw new ConfigInvalidException(
						RelSigText.get().newlineInQuotesNotAllowed);
			}
			if ('\\' == c) {
				// Unknown escapes drop the backslash, as C git does.
				c = in.read();
				if (c < 0) {
					throw new ConfigInvalidException(
							RelSigText.get().endOfFileInEscape);
				}
			}
			r.append((char) c);
		}
		return r.toString();
	}

	private static String readKeyName(StringReader in)
			throws ConfigInvalidException {
		StringBuilder name = new StringBuilder();
		for (;;) {
			int c = in.read();
			if (c < 0) {
				throw new ConfigInvalidException(
						RelSigText.get().unexpectedEndOfConfigFile);
			}
			if ('=' == c) {
				break;
			}
			if (' ' == c || '\t' == c) {
				for (;;) {
					c = in.read();
					if (c < 0) {
						throw new ConfigInvalidException(
								RelSigText.get().unexpectedEndOfConfigFile);
					}
					if ('=' == c) {
						break;
					}
					if (';' == c || '#' == c || '\n' == c) {
						in.reset();
						break;
					}
					if (' ' != c && '\t' != c) {
						throw new ConfigInvalidException(
								RelSigText.get().badEntryDelimiter);
					}
				}
				break;
			}
			if (Character.isLetterOrDigit((char) c) || '-' == c) {
				name.append((char) c);
			} else if ('\n' == c) {
				in.reset();
				name.append((char) c);
				break;
			} else {
				throw new ConfigInvalidException(MessageFormat
						.format(RelSigText.get().badEntryName, name));
			}
		}
		return name.toString();
	}

	private static String readValue(StringReader in)
			throws ConfigInvalidException {
		StringBuilder value = new StringBuilder();
		StringBuilder trailingSpaces = new StringBuilder();
		boolean quote = false;
		boolean inLeadingSpace = true;
		for (;;) {
			int c = in.read();
			if (c < 0) {
				break;
			}
			if ('\n' == c) {
				if (quote) {
					throw new ConfigInvalidException(
							RelSigText.get().newlineInQuotesNotAllowed);
				}
				in.reset();
				break;
			}
			if (!quote && (';' == c || '#' == c)) {
				trailingSpaces.setLength(0);
				in.reset();
				break;
			}
			char cc = (char) c;
			if (Character.isWhitespace(cc)) {
				if (!inLeadingSpace) {
					trailingSpaces.append(cc);
				}
				continue;
			}
			inLeadingSpace = false;
			value.append(trailingSpaces);
			trailingSpaces.setLength(0);

			if ('\\' == c) {
				c = in.read();
				switch (c) {
				case -1:
					throw new ConfigInvalidException(
							RelSigText.get().endOfFileInEscape);
				case '\n':
					continue;
				case 't':
					value.append('\t');
					continue;
				case 'n':
					value.append('\n');
					continue;
				case '\\':
					value.append('\\');
					continue;
				case '"':
					value.append('"');
					continue;
				default:
					throw new ConfigInvalidException(MessageFormat.format(
							RelSigText.get().badEscape,
							Character.valueOf((char) c)));
				}
			}
			if ('"' == c) {
				quote = !quote;
				continue;
			}
			value.append(cc);
		}
		return value.length() > 0 ? value.toString() : null;
	}

	private static class StringReader {
		private final char[] buf;

		private int pos;

		StringReader(String in) {
			buf = in.toCharArray();
		}

		int read() {
			if (pos >= buf.length) {
				return -1;
			}
			return buf[pos++];
		}

		void reset() {
			pos--;
		}
	}

	/**
	 * Converts enumeration values into configuration options and vice-versa,
	 * allowing to match a config option with an enum value.
	 */
	public interface ConfigEnum {
		/**
		 * Converts enumeration value into a string to be saved in config.
		 *
		 * @return the enum value as config string
		 */
		String toConfigValue();

		/**
		 * Checks if the given string matches with enum value.
		 *
		 * @param in
		 *            the string to match
		 * @return true if the given string matches enum value, false otherwise
		 */
		boolean matchConfigValue(String in);
	}
}
