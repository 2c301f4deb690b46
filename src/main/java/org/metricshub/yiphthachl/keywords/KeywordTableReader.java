package org.metricshub.yiphthachl.keywords;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Yiphthachl
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.metricshub.yiphthachl.util.YiphthachlLogger;
import org.slf4j.Logger;

/**
 * Loads a {@link KeywordTable} from a text file, on top of a base table.
 * <p>
 * Each non-blank line that does not start with <code>#</code> reads
 * <code>key = value, value, ...</code>, where the key is one of:
 * <ul>
 * <li><code>category.subkind</code>, like <code>conditional.if = if, when</code>
 * <li><code>category</code> alone, for flat categories, like <code>variable = set, let</code>
 * <li><code>color.name</code>, with a single <code>#RRGGBB</code> value
 * <li><code>boolean.true</code> or <code>boolean.false</code>
 * </ul>
 * A category (or the colors, or the booleans) mentioned in the file replaces
 * the one of the base table entirely; anything the file does not mention is
 * kept from the base table. Line order is phrase order.
 */
public class KeywordTableReader {

	private static final Logger LOG = YiphthachlLogger.getLogger(KeywordTableReader.class);

	private static final Pattern COLOR_CODE = Pattern.compile("#[0-9A-Fa-f]{6}");
	private static final String COLOR_KEY = "color";
	private static final String BOOLEAN_KEY = "boolean";

	private final KeywordTable base;

	/**
	 * Reader that overlays files on the built-in table.
	 */
	public KeywordTableReader() {
		this(KeywordTable.defaults());
	}

	/**
	 * @param base table providing every category a file does not mention
	 */
	public KeywordTableReader(KeywordTable base) {
		this.base = base;
	}

	/**
	 * Reads a UTF-8 keyword file.
	 *
	 * @param path the keyword file
	 * @return the resulting table
	 * @throws IOException when the file cannot be read
	 * @throws KeywordTableException when a line is malformed
	 */
	public KeywordTable read(Path path) throws IOException {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return read(reader, path.toString());
		}
	}

	/**
	 * Reads keyword definitions. The reader is not closed.
	 *
	 * @param reader keyword definitions
	 * @param description name of the table, for logs
	 * @return the resulting table
	 * @throws IOException when reading fails
	 * @throws KeywordTableException when a line is malformed
	 */
	public KeywordTable read(Reader reader, String description) throws IOException {
		KeywordTable.Builder builder = base.toBuilder().description(description);
		Set<KeywordCategory> replaced = EnumSet.noneOf(KeywordCategory.class);
		boolean colorsReplaced = false;
		boolean booleansReplaced = false;
		int entries = 0;

		BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
		String line;
		int lineNumber = 0;
		while ((line = lines.readLine()) != null) {
			lineNumber++;
			String text = line.trim();
			if (text.isEmpty() || text.startsWith("#")) {
				continue;
			}

			int equals = text.indexOf('=');
			if (equals <= 0) {
				throw new KeywordTableException("Expecting 'key = value'. Found: " + text, lineNumber);
			}
			String key = text.substring(0, equals).trim().toLowerCase(Locale.ROOT);
			List<String> values = splitValues(text.substring(equals + 1));
			if (values.isEmpty()) {
				throw new KeywordTableException("No value for " + key, lineNumber);
			}

			int dot = key.indexOf('.');
			String group = dot < 0 ? key : key.substring(0, dot);
			String name = dot < 0 ? null : key.substring(dot + 1).trim();
			if (name != null && name.isEmpty()) {
				throw new KeywordTableException("Missing name after '" + group + ".'", lineNumber);
			}

			if (COLOR_KEY.equals(group)) {
				if (name == null || values.size() != 1 || !COLOR_CODE.matcher(values.get(0)).matches()) {
					throw new KeywordTableException("Expecting 'color.name = #RRGGBB'. Found: " + text, lineNumber);
				}
				if (!colorsReplaced) {
					builder.clearColors();
					colorsReplaced = true;
				}
				builder.color(name, values.get(0));
			} else if (BOOLEAN_KEY.equals(group)) {
				if (!"true".equals(name) && !"false".equals(name)) {
					throw new KeywordTableException("Expecting boolean.true or boolean.false. Found: " + key, lineNumber);
				}
				if (!booleansReplaced) {
					builder.clearBooleans();
					booleansReplaced = true;
				}
				for (String word : values) {
					builder.booleanWord(word, Boolean.parseBoolean(name));
				}
			} else {
				KeywordCategory category = KeywordCategory.fromKey(group);
				if (category == null) {
					throw new KeywordTableException("Unknown keyword category: " + group, lineNumber);
				}
				String subKind = originalCaseName(text, dot, equals);
				if (subKind == null) {
					if (!category.isFlat()) {
						throw new KeywordTableException("Category " + group + " needs a sub-kind, like " + group + ".name", lineNumber);
					}
					subKind = category.getKey();
				}
				if (replaced.add(category)) {
					builder.clearCategory(category);
				}
				builder.phrases(category, subKind, values);
			}
			entries++;
		}

		LOG.debug("Read {} keyword entries from {}", entries, description);
		return builder.build();
	}

	/**
	 * Sub-kinds keep their case ("onPressed"), unlike phrases.
	 */
	private static String originalCaseName(String text, int dot, int equals) {
		if (dot < 0) {
			return null;
		}
		int start = text.indexOf('.');
		return text.substring(start + 1, equals).trim();
	}

	private static List<String> splitValues(String values) {
		List<String> result = new ArrayList<>();
		for (String value : values.split(",")) {
			String v = value.trim();
			if (!v.isEmpty()) {
				result.add(v);
			}
		}
		return result;
	}
}
