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
 * Operation on every kind of syntax tree node. Adding a node class adds a
 * method here, so that every visitor has to handle it.
 *
 * @param <R> result of the visit methods
 */
public interface AstVisitor<R> {

	// Declarations
	R visitProgram(ProgramAst node);

	R visitAppDeclaration(AppDeclarationAst node);

	R visitScreen(ScreenAst node);

	R visitVariableDeclaration(VariableDeclarationAst node);

	R visitFunctionDeclaration(FunctionDeclarationAst node);

	// Expressions
	R visitStringLiteral(StringLiteralAst node);

	R visitNumberLiteral(NumberLiteralAst node);

	R visitBooleanLiteral(BooleanLiteralAst node);

	R visitColorLiteral(ColorLiteralAst node);

	R visitListLiteral(ListLiteralAst node);

	R visitMapLiteral(MapLiteralAst node);

	R visitVariableReference(VariableReferenceAst node);

	R visitBinaryExpression(BinaryExpressionAst node);

	R visitUnaryExpression(UnaryExpressionAst node);

	R visitLogicalExpression(LogicalExpressionAst node);

	R visitComparisonExpression(ComparisonExpressionAst node);

	R visitFunctionCall(FunctionCallAst node);

	R visitAssignment(AssignmentAst node);

	// Control flow
	R visitBlock(BlockAst node);

	R visitIfStatement(IfStatementAst node);

	R visitWhileLoop(WhileLoopAst node);

	R visitForLoop(ForLoopAst node);

	R visitRepeatLoop(RepeatLoopAst node);

	// Widgets
	R visitScaffold(ScaffoldAst node);

	R visitAppBar(AppBarAst node);

	R visitColumn(ColumnAst node);

	R visitRow(RowAst node);

	R visitCenter(CenterAst node);

	R visitContainer(ContainerAst node);

	R visitCard(CardAst node);

	R visitText(TextAst node);

	R visitButton(ButtonAst node);

	R visitImage(ImageAst node);

	R visitIcon(IconAst node);

	R visitTextField(TextFieldAst node);

	R visitListView(ListViewAst node);

	R visitBottomNavigation(BottomNavigationAst node);

	R visitBottomNavItem(BottomNavItemAst node);

	R visitGenericWidget(GenericWidgetAst node);

	// Actions
	R visitEventHandler(EventHandlerAst node);

	R visitShowMessage(ShowMessageAst node);

	R visitNavigate(NavigateAst node);

	R visitGoBack(GoBackAst node);

	R visitUpdateState(UpdateStateAst node);

	R visitComment(CommentAst node);
}
