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

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Prints a syntax tree, one node per line. Children are indented below
 * their parent, under a label naming the field they belong to.
 */
final class AstDumper implements AstVisitor<Void> {

	private final PrintStream ps;
	private int level;

	AstDumper(PrintStream ps) {
		this.ps = ps;
	}

	private void line(String text) {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < level; i++) {
			spaces.append("  ");
		}
		ps.println(spaces + text);
	}

	private void nested(List<? extends AstNode> nodes) {
		level++;
		for (AstNode node : nodes) {
			node.accept(this);
		}
		level--;
	}

	private void child(String label, AstNode node) {
		if (node == null) {
			return;
		}
		level++;
		line(label + ":");
		level++;
		node.accept(this);
		level -= 2;
	}

	private void children(String label, List<? extends AstNode> nodes) {
		if (nodes.isEmpty()) {
			return;
		}
		level++;
		line(label + ":");
		nested(nodes);
		level--;
	}

	private void widget(WidgetAst node) {
		if (!node.getStyles().isEmpty()) {
			level++;
			line("styles: " + node.getStyles());
			level--;
		}
		for (Map.Entry<String, List<AstNode>> event : node.getEvents().entrySet()) {
			children("event " + event.getKey(), event.getValue());
		}
	}

	@Override
	public Void visitProgram(ProgramAst node) {
		line(node.toString());
		nested(node.getStatements());
		return null;
	}

	@Override
	public Void visitAppDeclaration(AppDeclarationAst node) {
		line(node.toString());
		children("screens", node.getScreens());
		children("configuration", node.getConfiguration());
		return null;
	}

	@Override
	public Void visitScreen(ScreenAst node) {
		line(node.toString());
		nested(node.getBody());
		return null;
	}

	@Override
	public Void visitVariableDeclaration(VariableDeclarationAst node) {
		line(node.toString());
		child("value", node.getValue());
		return null;
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclarationAst node) {
		line(node.toString());
		nested(node.getBody());
		return null;
	}

	@Override
	public Void visitStringLiteral(StringLiteralAst node) {
		line(node.toString());
		return null;
	}

	@Override
	public Void visitNumberLiteral(NumberLiteralAst node) {
		line(node.toString());
		return null;
	}

	@Override
	public Void visitBooleanLiteral(BooleanLiteralAst node) {
		line(node.toString());
		return null;
	}

	@Override
	public Void visitColorLiteral(ColorLiteralAst node) {
		line(node.toString());
		return null;
	}

	@Override
	public Void visitListLiteral(ListLiteralAst node) {
		line(node.toString());
		nested(node.getElements());
		return null;
	}

	@Override
	public Void visitMapLiteral(MapLiteralAst node) {
		line(node.toString());
		for (Map.Entry<String, AstNode> entry : node.getEntries().entrySet()) {
			child(entry.getKey(), entry.getValue());
		}
		return null;
	}

	@Override
	public Void visitVariableReference(VariableReferenceAst node) {
		line(node.toString());
		return null;
	}

	@Override
	public Void visitBinaryExpression(BinaryExpressionAst node) {
		line(node.toString());
		nested(Arrays.asList(node.getLeft(), node.getRight()));
		return null;
	}

	@Override
	public Void visitUnaryExpression(UnaryExpressionAst node) {
		line(node.toString());
		level++;
		node.getOperand().accept(this);
		level--;
		return null;
	}

	@Override
	public Void visitLogicalExpression(LogicalExpressionAst node) {
		line(node.toString());
		nested(Arrays.asList(node.getLeft(), node.getRight()));
		return null;
	}

	@Override
	public Void visitComparisonExpression(ComparisonExpressionAst node) {
		line(node.toString());
		nested(Arrays.asList(node.getLeft(), node.getRight()));
		return null;
	}

	@Override
	public Void visitFunctionCall(FunctionCallAst node) {
		line(node.toString());
		nested(node.getArguments());
		return null;
	}

	@Override
	public Void visitAssignment(AssignmentAst node) {
		line(node.toString());
		child("target", node.getTarget());
		child("value", node.getValue());
		return null;
	}

	@Override
	public Void visitBlock(BlockAst node) {
		line(node.toString());
		nested(node.getStatements());
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatementAst node) {
		line(node.toString());
		child("condition", node.getCondition());
		children("then", node.getConsequent());
		child("else", node.getAlternate());
		return null;
	}

	@Override
	public Void visitWhileLoop(WhileLoopAst node) {
		line(node.toString());
		child("condition", node.getCondition());
		children("body", node.getBody());
		return null;
	}

	@Override
	public Void visitForLoop(ForLoopAst node) {
		line(node.toString());
		child("in", node.getIterable());
		children("body", node.getBody());
		return null;
	}

	@Override
	public Void visitRepeatLoop(RepeatLoopAst node) {
		line(node.toString());
		child("count", node.getCount());
		children("body", node.getBody());
		return null;
	}

	@Override
	public Void visitScaffold(ScaffoldAst node) {
		line(node.toString());
		widget(node);
		child("appBar", node.getAppBar());
		child("body", node.getBody());
		child("bottomNavigation", node.getBottomNavigation());
		child("drawer", node.getDrawer());
		return null;
	}

	@Override
	public Void visitAppBar(AppBarAst node) {
		line(node.toString());
		widget(node);
		child("title", node.getTitle());
		return null;
	}

	@Override
	public Void visitColumn(ColumnAst node) {
		line(node.toString() + " align=" + node.getAlignment());
		widget(node);
		nested(node.getChildren());
		return null;
	}

	@Override
	public Void visitRow(RowAst node) {
		line(node.toString() + " align=" + node.getAlignment());
		widget(node);
		nested(node.getChildren());
		return null;
	}

	@Override
	public Void visitCenter(CenterAst node) {
		line(node.toString());
		widget(node);
		child("child", node.getChild());
		return null;
	}

	@Override
	public Void visitContainer(ContainerAst node) {
		line(node.toString());
		widget(node);
		nested(node.getChildren());
		return null;
	}

	@Override
	public Void visitCard(CardAst node) {
		line(node.toString());
		widget(node);
		nested(node.getChildren());
		return null;
	}

	@Override
	public Void visitText(TextAst node) {
		line(node.toString());
		widget(node);
		child("content", node.getContent());
		return null;
	}

	@Override
	public Void visitButton(ButtonAst node) {
		line(node.toString());
		widget(node);
		child("label", node.getLabel());
		return null;
	}

	@Override
	public Void visitImage(ImageAst node) {
		line(node.toString());
		widget(node);
		child("source", node.getSource());
		return null;
	}

	@Override
	public Void visitIcon(IconAst node) {
		line(node.toString());
		widget(node);
		return null;
	}

	@Override
	public Void visitTextField(TextFieldAst node) {
		line(node.toString());
		widget(node);
		return null;
	}

	@Override
	public Void visitListView(ListViewAst node) {
		line(node.toString());
		widget(node);
		nested(node.getItems());
		return null;
	}

	@Override
	public Void visitBottomNavigation(BottomNavigationAst node) {
		line(node.toString());
		widget(node);
		nested(node.getItems());
		return null;
	}

	@Override
	public Void visitBottomNavItem(BottomNavItemAst node) {
		line(node.toString());
		return null;
	}

	@Override
	public Void visitGenericWidget(GenericWidgetAst node) {
		line(node.toString() + (node.getProperties().isEmpty() ? "" : " " + node.getProperties()));
		widget(node);
		nested(node.getChildren());
		return null;
	}

	@Override
	public Void visitEventHandler(EventHandlerAst node) {
		line(node.toString());
		nested(node.getActions());
		return null;
	}

	@Override
	public Void visitShowMessage(ShowMessageAst node) {
		line(node.toString());
		child("message", node.getMessage());
		return null;
	}

	@Override
	public Void visitNavigate(NavigateAst node) {
		line(node.toString());
		return null;
	}

	@Override
	public Void visitGoBack(GoBackAst node) {
		line(node.toString());
		return null;
	}

	@Override
	public Void visitUpdateState(UpdateStateAst node) {
		line(node.toString());
		child("value", node.getNewValue());
		return null;
	}

	@Override
	public Void visitComment(CommentAst node) {
		line(node.toString());
		return null;
	}
}
