package org.metricshub.yiphthachl.frontend.ast;

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

/**
 * Discriminator of the {@link AstNode} classes, one constant per class.
 */
public enum NodeKind {
	PROGRAM("Program"),
	APP_DECLARATION("AppDeclaration"),
	SCREEN("Screen"),
	VARIABLE_DECLARATION("VariableDeclaration"),
	FUNCTION_DECLARATION("FunctionDeclaration"),

	STRING_LITERAL("StringLiteral"),
	NUMBER_LITERAL("NumberLiteral"),
	BOOLEAN_LITERAL("BooleanLiteral"),
	COLOR_LITERAL("ColorLiteral"),
	LIST_LITERAL("ListLiteral"),
	MAP_LITERAL("MapLiteral"),
	VARIABLE_REFERENCE("VariableReference"),
	BINARY_EXPRESSION("BinaryExpression"),
	UNARY_EXPRESSION("UnaryExpression"),
	LOGICAL_EXPRESSION("LogicalExpression"),
	COMPARISON_EXPRESSION("ComparisonExpression"),
	FUNCTION_CALL("FunctionCall"),
	ASSIGNMENT("Assignment"),

	BLOCK("Block"),
	IF_STATEMENT("IfStatement"),
	WHILE_LOOP("WhileLoop"),
	FOR_LOOP("ForLoop"),
	REPEAT_LOOP("RepeatLoop"),

	SCAFFOLD("Scaffold"),
	APP_BAR("AppBar"),
	COLUMN("Column"),
	ROW("Row"),
	CENTER("Center"),
	CONTAINER("Container"),
	CARD("Card"),
	TEXT("Text"),
	BUTTON("Button"),
	IMAGE("Image"),
	ICON("Icon"),
	TEXT_FIELD("TextField"),
	LIST_VIEW("ListView"),
	BOTTOM_NAVIGATION("BottomNavigation"),
	BOTTOM_NAV_ITEM("BottomNavItem"),
	WIDGET("Widget"),

	EVENT_HANDLER("EventHandler"),
	SHOW_MESSAGE("ShowMessage"),
	NAVIGATE("Navigate"),
	GO_BACK("GoBack"),
	UPDATE_STATE("UpdateState"),

	COMMENT("Comment");

	private final String label;

	NodeKind(String label) {
		this.label = label;
	}

	/**
	 * @return the name of the kind as printed in syntax tree dumps
	 */
	public String getLabel() {
		return label;
	}
}
