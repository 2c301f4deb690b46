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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Keyword vocabulary of the language: for each {@link KeywordCategory}, an
 * ordered map of sub-kinds to ordered phrase lists, plus the color names and
 * the boolean words.
 * <p>
 * Order is significant everywhere: when several sub-kinds of a category
 * match a word, the first one declared wins.
 * <p>
 * Instances are immutable and may be shared between threads. Use
 * {@link #defaults()} for the built-in English table, {@link #builder()} to
 * assemble one, or {@link KeywordTableReader} to load one from a file.
 */
public final class KeywordTable {

	private static final KeywordTable DEFAULT_TABLE = createDefaultTable();

	private final Map<KeywordCategory, Map<String, List<String>>> categories;
	private final Map<String, String> colors;
	private final Map<String, Boolean> booleans;
	private final String description;

	/** Every complete phrase, for phrase merging */
	private final Set<String> allPhrases;

	/** Every leading part of a multi-word phrase ("is greater" of "is greater than") */
	private final Set<String> phrasePrefixes;

	private KeywordTable(Builder builder) {
		Map<KeywordCategory, Map<String, List<String>>> copy = new EnumMap<>(KeywordCategory.class);
		for (Map.Entry<KeywordCategory, Map<String, List<String>>> entry : builder.categories.entrySet()) {
			Map<String, List<String>> subKinds = new LinkedHashMap<>();
			for (Map.Entry<String, List<String>> subKind : entry.getValue().entrySet()) {
				subKinds.put(subKind.getKey(), Collections.unmodifiableList(new ArrayList<>(subKind.getValue())));
			}
			copy.put(entry.getKey(), Collections.unmodifiableMap(subKinds));
		}
		this.categories = Collections.unmodifiableMap(copy);
		this.colors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.colors));
		this.booleans = Collections.unmodifiableMap(new LinkedHashMap<>(builder.booleans));
		this.description = builder.description;

		Set<String> phrases = new HashSet<>();
		Set<String> prefixes = new HashSet<>();
		for (Map<String, List<String>> subKinds : categories.values()) {
			for (List<String> list : subKinds.values()) {
				for (String phrase : list) {
					phrases.add(phrase);
					int space = phrase.indexOf(' ');
					while (space > 0) {
						prefixes.add(phrase.substring(0, space));
						space = phrase.indexOf(' ', space + 1);
					}
				}
			}
		}
		phrases.addAll(colors.keySet());
		this.allPhrases = Collections.unmodifiableSet(phrases);
		this.phrasePrefixes = Collections.unmodifiableSet(prefixes);
	}

	/**
	 * @return the built-in English keyword table
	 */
	public static KeywordTable defaults() {
		return DEFAULT_TABLE;
	}

	/**
	 * @return an empty builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return a builder pre-filled with the content of this table
	 */
	public Builder toBuilder() {
		Builder builder = new Builder();
		for (Map.Entry<KeywordCategory, Map<String, List<String>>> entry : categories.entrySet()) {
			for (Map.Entry<String, List<String>> subKind : entry.getValue().entrySet()) {
				builder.phrases(entry.getKey(), subKind.getKey(), subKind.getValue());
			}
		}
		builder.colors.putAll(colors);
		builder.booleans.putAll(booleans);
		builder.description = description;
		return builder;
	}

	/**
	 * @param category a keyword category
	 * @return the ordered sub-kinds of the category with their phrases, possibly empty
	 */
	public Map<String, List<String>> getSubKinds(KeywordCategory category) {
		Map<String, List<String>> subKinds = categories.get(category);
		return subKinds == null ? Collections.<String, List<String>>emptyMap() : subKinds;
	}

	/**
	 * @param category a keyword category
	 * @param subKind a sub-kind of the category
	 * @return the ordered phrases of the sub-kind, possibly empty
	 */
	public List<String> getPhrases(KeywordCategory category, String subKind) {
		List<String> phrases = getSubKinds(category).get(subKind);
		return phrases == null ? Collections.<String>emptyList() : phrases;
	}

	/**
	 * Finds the first sub-kind of a category that lists the phrase as is.
	 *
	 * @param category category to search
	 * @param phrase lower-case phrase
	 * @return the sub-kind, or <code>null</code>
	 */
	public String findExact(KeywordCategory category, String phrase) {
		for (Map.Entry<String, List<String>> entry : getSubKinds(category).entrySet()) {
			if (entry.getValue().contains(phrase)) {
				return entry.getKey();
			}
		}
		return null;
	}

	/**
	 * Finds the first sub-kind of a category with a phrase the given text starts with.
	 *
	 * @param category category to search
	 * @param text lower-case text
	 * @return the sub-kind, or <code>null</code>
	 */
	public String findPrefixOf(KeywordCategory category, String text) {
		for (Map.Entry<String, List<String>> entry : getSubKinds(category).entrySet()) {
			for (String phrase : entry.getValue()) {
				if (text.startsWith(phrase)) {
					return entry.getKey();
				}
			}
		}
		return null;
	}

	/**
	 * Finds the first sub-kind of a category with a phrase contained in the given text.
	 *
	 * @param category category to search
	 * @param text lower-case text
	 * @return the sub-kind, or <code>null</code>
	 */
	public String findContainedIn(KeywordCategory category, String text) {
		for (Map.Entry<String, List<String>> entry : getSubKinds(category).entrySet()) {
			for (String phrase : entry.getValue()) {
				if (text.contains(phrase)) {
					return entry.getKey();
				}
			}
		}
		return null;
	}

	/**
	 * @param phrase lower-case words separated by single spaces
	 * @return whether the phrase is listed in any category or is a color name
	 */
	public boolean isPhrase(String phrase) {
		return allPhrases.contains(phrase);
	}

	/**
	 * @param words lower-case words separated by single spaces
	 * @return whether a longer phrase starts with these words
	 */
	public boolean isPhrasePrefix(String words) {
		return phrasePrefixes.contains(words);
	}

	/**
	 * @param name lower-case color name
	 * @return the hexadecimal color code, or <code>null</code> if the name is not a color
	 */
	public String getColorCode(String name) {
		return colors.get(name);
	}

	/**
	 * @param word lower-case word
	 * @return the boolean the word stands for, or <code>null</code>
	 */
	public Boolean getBooleanValue(String word) {
		return booleans.get(word);
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return description;
	}

	/**
	 * Assembles a {@link KeywordTable}. Phrases are trimmed and lower-cased.
	 */
	public static final class Builder {

		private final Map<KeywordCategory, Map<String, List<String>>> categories = new EnumMap<>(KeywordCategory.class);
		private final Map<String, String> colors = new LinkedHashMap<>();
		private final Map<String, Boolean> booleans = new LinkedHashMap<>();
		private String description = "custom keyword table";

		private Builder() {}

		/**
		 * Sets (or replaces) the phrases of a sub-kind. New sub-kinds are added after
		 * the existing ones of the category.
		 *
		 * @param category category of the phrases
		 * @param subKind sub-kind; for flat categories, the category key
		 * @param phrases ordered phrases
		 * @return this builder
		 */
		public Builder phrases(KeywordCategory category, String subKind, List<String> phrases) {
			List<String> normalized = new ArrayList<>(phrases.size());
			for (String phrase : phrases) {
				String p = normalize(phrase);
				if (!p.isEmpty() && !normalized.contains(p)) {
					normalized.add(p);
				}
			}
			categories.computeIfAbsent(category, c -> new LinkedHashMap<>()).put(subKind, normalized);
			return this;
		}

		/**
		 * @param category category of the phrases
		 * @param subKind sub-kind; for flat categories, the category key
		 * @param phrases ordered phrases
		 * @return this builder
		 * @see #phrases(KeywordCategory, String, List)
		 */
		public Builder phrases(KeywordCategory category, String subKind, String... phrases) {
			return phrases(category, subKind, Arrays.asList(phrases));
		}

		/**
		 * Sets the phrases of a flat category.
		 *
		 * @param category a flat category
		 * @param phrases ordered phrases
		 * @return this builder
		 */
		public Builder flat(KeywordCategory category, String... phrases) {
			if (!category.isFlat()) {
				throw new IllegalArgumentException(category + " has sub-kinds");
			}
			return phrases(category, category.getKey(), phrases);
		}

		/**
		 * Removes every sub-kind of a category.
		 *
		 * @param category category to empty
		 * @return this builder
		 */
		public Builder clearCategory(KeywordCategory category) {
			categories.remove(category);
			return this;
		}

		/**
		 * @param name color name
		 * @param code hexadecimal code, like <code>#EF4444</code>
		 * @return this builder
		 */
		public Builder color(String name, String code) {
			colors.put(normalize(name), code.trim());
			return this;
		}

		/**
		 * @return this builder, without any color name
		 */
		public Builder clearColors() {
			colors.clear();
			return this;
		}

		/**
		 * @param word a word standing for a boolean value
		 * @param value the value
		 * @return this builder
		 */
		public Builder booleanWord(String word, boolean value) {
			booleans.put(normalize(word), Boolean.valueOf(value));
			return this;
		}

		/**
		 * @return this builder, without any boolean word
		 */
		public Builder clearBooleans() {
			booleans.clear();
			return this;
		}

		/**
		 * @param description short text identifying the table in logs
		 * @return this builder
		 */
		public Builder description(String description) {
			this.description = description;
			return this;
		}

		/**
		 * @return the immutable table
		 */
		public KeywordTable build() {
			return new KeywordTable(this);
		}

		private static String normalize(String phrase) {
			return phrase.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
		}
	}

	private static KeywordTable createDefaultTable() {
		Builder b = builder().description("built-in English keyword table");

		b.flat(KeywordCategory.VARIABLE_DECLARATION, "set", "let", "make", "create", "define", "remember", "store");
		b.flat(KeywordCategory.ASSIGNMENT, "to", "as", "equals", "be", "is");
		b.flat(KeywordCategory.FUNCTION_DECLARATION, "give function", "create function", "define function", "make function");
		b.flat(KeywordCategory.FUNCTION_CALL, "do", "call", "run", "execute", "perform");

		b.phrases(KeywordCategory.CONDITIONAL, "if", "if", "when", "in case", "assuming");
		b.phrases(KeywordCategory.CONDITIONAL, "else", "otherwise", "else", "or else", "if not");
		b.phrases(KeywordCategory.CONDITIONAL, "elseif", "otherwise if", "else if", "or if");
		b.phrases(KeywordCategory.CONDITIONAL, "end", "end if", "end when", "end condition");

		b.phrases(KeywordCategory.LOOP, "for", "for each", "for every", "loop through");
		b.phrases(KeywordCategory.LOOP, "while", "while", "as long as", "keep doing while");
		b.phrases(KeywordCategory.LOOP, "repeat", "repeat", "do this");
		b.phrases(KeywordCategory.LOOP, "times", "times", "iterations");
		b.phrases(KeywordCategory.LOOP, "end", "end repeat", "end for", "end while", "end loop");

		b.phrases(KeywordCategory.COMPARISON, "equals", "equals", "is equal to", "is the same as", "matches", "is", "==");
		b.phrases(KeywordCategory.COMPARISON, "notEquals", "is not", "does not equal", "is different from", "!=");
		b.phrases(KeywordCategory.COMPARISON, "greaterThan", "is greater than", "is more than", "exceeds", "is above", ">");
		b.phrases(KeywordCategory.COMPARISON, "lessThan", "is less than", "is fewer than", "is below", "is under", "<");
		b.phrases(KeywordCategory.COMPARISON, "greaterOrEqual", "is at least", "is greater or equal to", ">=");
		b.phrases(KeywordCategory.COMPARISON, "lessOrEqual", "is at most", "is less or equal to", "<=");
		b.phrases(KeywordCategory.COMPARISON, "and", "and", "also", "as well as", "&&");
		b.phrases(KeywordCategory.COMPARISON, "or", "or", "alternatively", "||");
		b.phrases(KeywordCategory.COMPARISON, "not", "not", "isnt", "isn't", "!");

		b.phrases(KeywordCategory.ARITHMETIC, "add", "add", "plus", "increase by", "+");
		b.phrases(KeywordCategory.ARITHMETIC, "subtract", "subtract", "minus", "decrease by", "take away", "-");
		b.phrases(KeywordCategory.ARITHMETIC, "multiply", "multiply", "times", "multiplied by", "*");
		b.phrases(KeywordCategory.ARITHMETIC, "divide", "divide", "divided by", "split by", "/");
		b.phrases(KeywordCategory.ARITHMETIC, "modulo", "remainder of", "modulo", "%");

		// Sub-kind order decides substring matches ("a text field" contains "a text")
		b.phrases(KeywordCategory.WIDGET, "app", "create an app", "make an app", "build an app", "start an app");
		b.phrases(KeywordCategory.WIDGET, "screen", "on the screen", "define screen", "create screen", "the main screen");
		b.phrases(KeywordCategory.WIDGET, "scaffold", "use a scaffold", "create a scaffold", "with scaffold");
		b.phrases(KeywordCategory.WIDGET, "column", "a column", "put a column", "vertical layout", "stack vertically");
		b.phrases(KeywordCategory.WIDGET, "row", "a row", "put a row", "horizontal layout", "stack horizontally");
		b.phrases(KeywordCategory.WIDGET, "stack", "a stack", "overlay", "put on top");
		b.phrases(KeywordCategory.WIDGET, "center", "in the center", "centered", "center this");
		b.phrases(KeywordCategory.WIDGET, "container", "a container", "a box", "wrap in");
		b.phrases(KeywordCategory.WIDGET, "card", "a card", "card view");
		b.phrases(KeywordCategory.WIDGET, "text", "a text", "some text", "text that says", "words that say");
		b.phrases(KeywordCategory.WIDGET, "button", "a button", "clickable button", "button that says");
		b.phrases(KeywordCategory.WIDGET, "image", "an image", "a picture", "image from");
		b.phrases(KeywordCategory.WIDGET, "icon", "an icon", "icon of", "symbol of");
		b.phrases(KeywordCategory.WIDGET, "textField", "a text field", "input field", "text input", "type box");
		b.phrases(KeywordCategory.WIDGET, "checkbox", "a checkbox", "check box", "tick box");
		b.phrases(KeywordCategory.WIDGET, "switch", "a switch", "toggle", "on off switch");
		b.phrases(KeywordCategory.WIDGET, "slider", "a slider", "slide control", "range slider");
		b.phrases(KeywordCategory.WIDGET, "dropdown", "a dropdown", "select menu", "picker");
		b.phrases(KeywordCategory.WIDGET, "appBar", "a title bar", "app bar", "top bar", "header");
		b.phrases(KeywordCategory.WIDGET, "bottomNav", "bottom navigation", "bottom menu", "footer navigation");
		b.phrases(KeywordCategory.WIDGET, "drawer", "a drawer", "side menu", "navigation drawer");
		b.phrases(KeywordCategory.WIDGET, "listView", "a list", "show a list", "list view", "scrollable list");
		b.phrases(KeywordCategory.WIDGET, "gridView", "a grid", "grid view", "grid layout");
		b.phrases(KeywordCategory.WIDGET, "dialog", "a dialog", "popup", "modal", "alert");
		b.phrases(KeywordCategory.WIDGET, "snackbar", "a snackbar", "toast message", "notification");
		b.phrases(KeywordCategory.WIDGET, "bottomSheet", "bottom sheet", "bottom panel", "slide up panel");

		b.phrases(KeywordCategory.STYLE, "color", "color it", "make it", "with color", "colored");
		b.phrases(KeywordCategory.STYLE, "background", "background", "background color", "fill with");
		b.phrases(KeywordCategory.STYLE, "width", "width", "wide", "make the width");
		b.phrases(KeywordCategory.STYLE, "height", "height", "tall", "make the height");
		b.phrases(KeywordCategory.STYLE, "size", "size", "make the size");
		b.phrases(KeywordCategory.STYLE, "padding", "padding", "inner space", "space inside");
		b.phrases(KeywordCategory.STYLE, "margin", "margin", "outer space", "space outside");
		b.phrases(KeywordCategory.STYLE, "space", "add some space", "space of", "gap of");
		b.phrases(KeywordCategory.STYLE, "bold", "make it bold", "bold", "strong");
		b.phrases(KeywordCategory.STYLE, "italic", "make it italic", "italic", "slanted");
		b.phrases(KeywordCategory.STYLE, "underline", "underline", "underlined");
		b.phrases(KeywordCategory.STYLE, "fontSize", "font size", "text size", "size");
		b.phrases(KeywordCategory.STYLE, "border", "border", "outline", "edge");
		b.phrases(KeywordCategory.STYLE, "rounded", "round the corners", "rounded", "corner radius");
		b.phrases(KeywordCategory.STYLE, "shadow", "add shadow", "drop shadow", "shadow");
		b.phrases(KeywordCategory.STYLE, "alignLeft", "align left", "left aligned", "to the left");
		b.phrases(KeywordCategory.STYLE, "alignRight", "align right", "right aligned", "to the right");
		b.phrases(KeywordCategory.STYLE, "alignCenter", "align center", "centered", "in the middle");

		b.phrases(KeywordCategory.EVENT, "onPressed", "when pressed", "when clicked", "on click", "on tap", "when tapped");
		b.phrases(KeywordCategory.EVENT, "onChanged", "when changed", "on change", "when updated");
		b.phrases(KeywordCategory.EVENT, "onSubmit", "when submitted", "on submit", "when done");
		b.phrases(KeywordCategory.EVENT, "onHover", "when hovered", "on hover", "mouse over");
		b.phrases(KeywordCategory.EVENT, "onFocus", "when focused", "on focus");
		b.phrases(KeywordCategory.EVENT, "onBlur", "when unfocused", "on blur", "when left");

		b.phrases(KeywordCategory.NAVIGATION, "goto", "go to", "navigate to", "open", "show");
		b.phrases(KeywordCategory.NAVIGATION, "back", "go back", "return", "previous screen");
		b.phrases(KeywordCategory.NAVIGATION, "replace", "replace with", "switch to");

		b.phrases(KeywordCategory.STATE, "remember", "remember", "keep track of", "store", "save");
		b.phrases(KeywordCategory.STATE, "update", "update", "change", "modify", "set");
		b.phrases(KeywordCategory.STATE, "watch", "whenever", "watch", "observe", "when changes");

		b.phrases(KeywordCategory.HTTP, "fetch", "fetch", "get data from", "load from", "retrieve from");
		b.phrases(KeywordCategory.HTTP, "post", "send data to", "post to", "submit to");
		b.phrases(KeywordCategory.HTTP, "put", "update at", "put to");
		b.phrases(KeywordCategory.HTTP, "delete", "delete from", "remove from");

		b.phrases(KeywordCategory.ANIMATION, "animate", "animate", "transition");
		b.phrases(KeywordCategory.ANIMATION, "fadeIn", "fade in", "appear");
		b.phrases(KeywordCategory.ANIMATION, "fadeOut", "fade out", "disappear");
		b.phrases(KeywordCategory.ANIMATION, "slideIn", "slide in", "enter from");
		b.phrases(KeywordCategory.ANIMATION, "slideOut", "slide out", "exit to");
		b.phrases(KeywordCategory.ANIMATION, "scale", "scale", "grow", "shrink");
		b.phrases(KeywordCategory.ANIMATION, "rotate", "rotate", "spin", "turn");
		b.phrases(KeywordCategory.ANIMATION, "duration", "over", "duration", "for", "lasting");

		b.color("red", "#EF4444");
		b.color("orange", "#F97316");
		b.color("amber", "#F59E0B");
		b.color("yellow", "#EAB308");
		b.color("lime", "#84CC16");
		b.color("green", "#22C55E");
		b.color("emerald", "#10B981");
		b.color("teal", "#14B8A6");
		b.color("cyan", "#06B6D4");
		b.color("sky", "#0EA5E9");
		b.color("blue", "#3B82F6");
		b.color("indigo", "#6366F1");
		b.color("violet", "#8B5CF6");
		b.color("purple", "#A855F7");
		b.color("fuchsia", "#D946EF");
		b.color("pink", "#EC4899");
		b.color("rose", "#F43F5E");
		b.color("white", "#FFFFFF");
		b.color("black", "#000000");
		b.color("gray", "#6B7280");
		b.color("grey", "#6B7280");
		b.color("slate", "#64748B");

		b.booleanWord("true", true);
		b.booleanWord("yes", true);
		b.booleanWord("false", false);
		b.booleanWord("no", false);

		return b.build();
	}
}
