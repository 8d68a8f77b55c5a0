package org.csu.crusty.compiler.parser;

import org.csu.crusty.common.exception.ParseException;
import org.csu.crusty.compiler.lexer.Lexer;
import org.csu.crusty.compiler.lexer.Token;
import org.csu.crusty.compiler.parser.ast.AttributeNode;
import org.csu.crusty.compiler.parser.ast.CrustyFile;
import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.MacroDelimiter;
import org.csu.crusty.compiler.parser.ast.StatementNode;
import org.csu.crusty.compiler.parser.ast.Visibility;
import org.csu.crusty.compiler.parser.ast.expression.*;
import org.csu.crusty.compiler.parser.ast.item.*;
import org.csu.crusty.compiler.parser.ast.statement.*;
import org.csu.crusty.compiler.parser.ast.type.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: Parser 类的单元测试
 */
public class ParserTest {

    private CrustyFile parse(String source) {
        System.out.println("Input Crusty: " + source);
        List<Token> tokens = new Lexer(source).tokenize();
        System.out.println("Tokens: " + tokens.size());
        CrustyFile file = new Parser(tokens).parse();
        System.out.println("AST: " + file);
        return file;
    }

    private ExpressionNode expression(String source) {
        System.out.println("Input expression: " + source);
        ExpressionNode node = Parser.fromSource(source).parseExpression();
        System.out.println("AST: " + node);
        return node;
    }

    private List<StatementNode> body(String statements) {
        CrustyFile file = parse("void f() { " + statements + " }");
        return ((FunctionNode) file.items().get(0)).body().statements();
    }

    @Test
    void testFunctionWithLetDeclaration() {
        System.out.println("--- Running test: testFunctionWithLetDeclaration ---");
        CrustyFile file = parse("int main() { let int x = 42; return x; }");

        assertEquals(1, file.items().size());
        FunctionNode main = assertInstanceOf(FunctionNode.class, file.items().get(0));
        assertEquals("main", main.name());
        assertEquals(Visibility.PUBLIC, main.visibility());
        assertEquals(new PrimitiveTypeNode(PrimitiveKind.INT), main.returnType());

        LetStatementNode let = assertInstanceOf(LetStatementNode.class, main.body().statements().get(0));
        assertEquals("x", let.name());
        assertEquals(new PrimitiveTypeNode(PrimitiveKind.INT), let.type());
        assertEquals(LiteralNode.ofInt(42), let.init());
        assertFalse(let.mutable());
        assertInstanceOf(ReturnStatementNode.class, main.body().statements().get(1));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testStaticFunctionIsPrivateAndVoidHasNoReturnType() {
        System.out.println("--- Running test: testStaticFunctionIsPrivateAndVoidHasNoReturnType ---");
        CrustyFile file = parse("static void helper(int a, float b) { }");

        FunctionNode helper = (FunctionNode) file.items().get(0);
        assertEquals(Visibility.PRIVATE, helper.visibility());
        assertNull(helper.returnType(), "void return type is represented as null");
        assertEquals(2, helper.params().size());
        assertEquals(new PrimitiveTypeNode(PrimitiveKind.FLOAT), helper.params().get(1).type());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testDeclarationForms() {
        System.out.println("--- Running test: testDeclarationForms ---");
        List<StatementNode> statements = body(
                "int a = 1; var b: int = 2; var c; const LIMIT: int = 10; Point* p = q; let d = 3;");

        LetStatementNode implicit = assertInstanceOf(LetStatementNode.class, statements.get(0));
        assertFalse(implicit.mutable(), "implicit declarations are immutable");
        assertEquals("a", implicit.name());

        VarStatementNode typedVar = assertInstanceOf(VarStatementNode.class, statements.get(1));
        assertEquals(new PrimitiveTypeNode(PrimitiveKind.INT), typedVar.type());

        VarStatementNode bareVar = assertInstanceOf(VarStatementNode.class, statements.get(2));
        assertNull(bareVar.type());
        assertNull(bareVar.init());

        ConstStatementNode constant = assertInstanceOf(ConstStatementNode.class, statements.get(3));
        assertEquals("LIMIT", constant.name());

        LetStatementNode pointer = assertInstanceOf(LetStatementNode.class, statements.get(4));
        assertEquals(new PointerTypeNode(new NamedTypeNode("Point"), true), pointer.type());

        LetStatementNode untyped = assertInstanceOf(LetStatementNode.class, statements.get(5));
        assertNull(untyped.type());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testIdentifierFollowedByAssignIsAlwaysAssignment() {
        System.out.println("--- Running test: testIdentifierFollowedByAssignIsAlwaysAssignment ---");
        List<StatementNode> statements = body("x = 5; a = b = 1;");

        ExpressionStatementNode first = assertInstanceOf(ExpressionStatementNode.class, statements.get(0));
        BinaryExpressionNode assign = assertInstanceOf(BinaryExpressionNode.class, first.expression());
        assertEquals(BinaryOperator.ASSIGN, assign.operator());
        assertEquals("x", assertInstanceOf(IdentifierNode.class, assign.left()).name());

        BinaryExpressionNode chained = (BinaryExpressionNode) ((ExpressionStatementNode) statements.get(1)).expression();
        assertInstanceOf(IdentifierNode.class, chained.left());
        BinaryExpressionNode inner = assertInstanceOf(BinaryExpressionNode.class, chained.right(),
                "assignment is right-associative");
        assertEquals(BinaryOperator.ASSIGN, inner.operator());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testNestedFunctionDeclaration() {
        System.out.println("--- Running test: testNestedFunctionDeclaration ---");
        List<StatementNode> statements = body("let x: int = 1; int add_x(int y) { return x + y; } add_x(2);");

        NestedFunctionNode nested = assertInstanceOf(NestedFunctionNode.class, statements.get(1));
        assertEquals("add_x", nested.name());
        assertEquals(1, nested.params().size());
        assertEquals("y", nested.params().get(0).name());
        assertEquals(new PrimitiveTypeNode(PrimitiveKind.INT), nested.returnType());

        ExpressionStatementNode call = assertInstanceOf(ExpressionStatementNode.class, statements.get(2));
        assertInstanceOf(CallExpressionNode.class, call.expression());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testParenthesisDisambiguation() {
        System.out.println("--- Running test: testParenthesisDisambiguation ---");
        CastExpressionNode cast = assertInstanceOf(CastExpressionNode.class, expression("(int)x"));
        assertEquals(new PrimitiveTypeNode(PrimitiveKind.INT), cast.type());
        assertInstanceOf(IdentifierNode.class, cast.expression());

        CastExpressionNode namedCast = assertInstanceOf(CastExpressionNode.class, expression("(Meters)value"));
        assertEquals(new NamedTypeNode("Meters"), namedCast.type());

        TupleLiteralNode tuple = assertInstanceOf(TupleLiteralNode.class, expression("(a, b)"));
        assertEquals(2, tuple.elements().size());
        assertEquals(0, assertInstanceOf(TupleLiteralNode.class, expression("()")).elements().size());

        assertInstanceOf(IdentifierNode.class, expression("(a)"));
        BinaryExpressionNode sum = assertInstanceOf(BinaryExpressionNode.class, expression("(a) + b"));
        assertEquals(BinaryOperator.ADD, sum.operator());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testOperatorPrecedence() {
        System.out.println("--- Running test: testOperatorPrecedence ---");
        BinaryExpressionNode sum = assertInstanceOf(BinaryExpressionNode.class, expression("1 + 2 * 3"));
        assertEquals(BinaryOperator.ADD, sum.operator());
        assertEquals(BinaryOperator.MUL, ((BinaryExpressionNode) sum.right()).operator());

        BinaryExpressionNode or = assertInstanceOf(BinaryExpressionNode.class, expression("a == 1 || b < 2 && c"));
        assertEquals(BinaryOperator.OR, or.operator());
        assertEquals(BinaryOperator.AND, ((BinaryExpressionNode) or.right()).operator());

        TernaryExpressionNode ternary = assertInstanceOf(TernaryExpressionNode.class, expression("a > b ? a : b"));
        assertInstanceOf(BinaryExpressionNode.class, ternary.condition());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUnaryAndPostfixOperators() {
        System.out.println("--- Running test: testUnaryAndPostfixOperators ---");
        UnaryExpressionNode refMut = assertInstanceOf(UnaryExpressionNode.class, expression("&var x"));
        assertEquals(UnaryOperator.REF_MUT, refMut.operator());

        UnaryExpressionNode postInc = assertInstanceOf(UnaryExpressionNode.class, expression("i++"));
        assertEquals(UnaryOperator.POST_INC, postInc.operator());

        FieldAccessNode arrow = assertInstanceOf(FieldAccessNode.class, expression("p->x"));
        assertEquals("x", arrow.field());
        assertEquals(UnaryOperator.DEREF, ((UnaryExpressionNode) arrow.target()).operator());

        MethodCallNode method = assertInstanceOf(MethodCallNode.class, expression("list.push(1)"));
        assertEquals("push", method.method());

        FieldAccessNode tupleIndex = assertInstanceOf(FieldAccessNode.class, expression("pair.0"));
        assertEquals("0", tupleIndex.field());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testStructWithFieldsAndMethods() {
        System.out.println("--- Running test: testStructWithFieldsAndMethods ---");
        CrustyFile file = parse("struct Point { int x; int y; int sum(&self) { return self.x + self.y; } "
                + "static Point origin() { return (Point){ .x = 0, .y = 0 }; } }");

        StructNode point = assertInstanceOf(StructNode.class, file.items().get(0));
        assertEquals(2, point.fields().size());
        assertEquals(2, point.methods().size());

        FunctionNode sum = point.methods().get(0);
        assertEquals(Visibility.PUBLIC, sum.visibility());
        assertTrue(sum.params().get(0).isSelf());
        assertEquals(new ReferenceTypeNode(new NamedTypeNode("Self"), false), sum.params().get(0).type());

        FunctionNode origin = point.methods().get(1);
        assertEquals(Visibility.PRIVATE, origin.visibility());
        ReturnStatementNode ret = (ReturnStatementNode) origin.body().statements().get(0);
        StructInitNode init = assertInstanceOf(StructInitNode.class, ret.value());
        assertEquals(new NamedTypeNode("Point"), init.type());
        assertEquals(2, init.fields().size());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUntypedStructInitializerTakesDeclaredType() {
        System.out.println("--- Running test: testUntypedStructInitializerTakesDeclaredType ---");
        List<StatementNode> statements = body("Point p = { .x = 1, .y = 2 };");

        LetStatementNode let = assertInstanceOf(LetStatementNode.class, statements.get(0));
        StructInitNode init = assertInstanceOf(StructInitNode.class, let.init());
        assertEquals(new NamedTypeNode("Point"), init.type());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEnumDiscriminantsAutoIncrement() {
        System.out.println("--- Running test: testEnumDiscriminantsAutoIncrement ---");
        CrustyFile file = parse("enum Color { Red, Green = 5, Blue, Cold = -2, Colder };");

        EnumNode color = assertInstanceOf(EnumNode.class, file.items().get(0));
        List<Long> values = color.variants().stream().map(EnumVariantNode::value).toList();
        assertEquals(List.of(0L, 5L, 6L, -2L, -1L), values);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTypedefAndGenericClosingShift() {
        System.out.println("--- Running test: testTypedefAndGenericClosingShift ---");
        CrustyFile file = parse("typedef Vec<Vec<int>> Grid; void f() { Vec<Vec<int>> v = make(); a < b >> c; }");

        TypedefNode grid = assertInstanceOf(TypedefNode.class, file.items().get(0));
        GenericTypeNode outer = assertInstanceOf(GenericTypeNode.class, grid.target());
        assertInstanceOf(GenericTypeNode.class, outer.arguments().get(0));

        List<StatementNode> statements = ((FunctionNode) file.items().get(1)).body().statements();
        LetStatementNode let = assertInstanceOf(LetStatementNode.class, statements.get(0));
        assertInstanceOf(GenericTypeNode.class, let.type());

        // 试探解析失败后 '>>' 必须恢复为移位运算符
        BinaryExpressionNode less = (BinaryExpressionNode) ((ExpressionStatementNode) statements.get(1)).expression();
        assertEquals(BinaryOperator.LT, less.operator());
        assertEquals(BinaryOperator.SHR, ((BinaryExpressionNode) less.right()).operator());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testForLoops() {
        System.out.println("--- Running test: testForLoops ---");
        List<StatementNode> statements = body(
                "for (int i = 0; i < 10; i++) { } for (;;) { break; } for (item in 0..10) { }");

        ForStatementNode classic = assertInstanceOf(ForStatementNode.class, statements.get(0));
        assertInstanceOf(LetStatementNode.class, classic.init());
        assertEquals(BinaryOperator.LT, ((BinaryExpressionNode) classic.condition()).operator());
        assertEquals(UnaryOperator.POST_INC, ((UnaryExpressionNode) classic.increment()).operator());

        ForStatementNode forever = assertInstanceOf(ForStatementNode.class, statements.get(1));
        assertNull(forever.init());
        assertEquals(LiteralNode.ofBool(true), forever.condition());
        assertNull(forever.increment());

        ForInStatementNode forIn = assertInstanceOf(ForInStatementNode.class, statements.get(2));
        assertEquals("item", forIn.variable());
        RangeExpressionNode range = assertInstanceOf(RangeExpressionNode.class, forIn.iterable());
        assertFalse(range.inclusive());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testLabeledLoopsAndJumps() {
        System.out.println("--- Running test: testLabeledLoopsAndJumps ---");
        List<StatementNode> statements = body(".outer: while (true) { break outer; continue .outer; } loop { break; }");

        WhileStatementNode labeled = assertInstanceOf(WhileStatementNode.class, statements.get(0));
        assertEquals("outer", labeled.label());
        assertEquals("outer", ((BreakStatementNode) labeled.body().statements().get(0)).label());
        assertEquals("outer", ((ContinueStatementNode) labeled.body().statements().get(1)).label());

        WhileStatementNode loop = assertInstanceOf(WhileStatementNode.class, statements.get(1));
        assertNull(loop.label());
        assertEquals(LiteralNode.ofBool(true), loop.condition());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSwitchAndElseIf() {
        System.out.println("--- Running test: testSwitchAndElseIf ---");
        List<StatementNode> statements = body(
                "switch (x) { case 1, 2: y = 1; break; case 3: { y = 2; } default: y = 0; } "
                        + "if (a) { } else if (b) { } else { }");

        SwitchStatementNode switchStatement = assertInstanceOf(SwitchStatementNode.class, statements.get(0));
        assertEquals(2, switchStatement.cases().size());
        assertEquals(2, switchStatement.cases().get(0).values().size());
        assertEquals(2, switchStatement.cases().get(0).body().statements().size());
        assertNotNull(switchStatement.defaultBlock());

        IfStatementNode ifStatement = assertInstanceOf(IfStatementNode.class, statements.get(1));
        IfStatementNode elseIf = assertInstanceOf(IfStatementNode.class, ifStatement.elseBlock().statements().get(0));
        assertNotNull(elseIf.elseBlock());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTypeScopedCalls() {
        System.out.println("--- Running test: testTypeScopedCalls ---");
        TypeScopedCallNode scoped = assertInstanceOf(TypeScopedCallNode.class, expression("@Vec.new()"));
        assertEquals(new NamedTypeNode("Vec"), scoped.type());
        assertEquals("new", scoped.method());

        ExplicitGenericCallNode generic = assertInstanceOf(ExplicitGenericCallNode.class,
                expression("@Vec(int).with_capacity(10)"));
        assertEquals(List.of(new PrimitiveTypeNode(PrimitiveKind.INT)), generic.generics());
        assertEquals(1, generic.arguments().size());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testMacroDefinitionAndInvocation() {
        System.out.println("--- Running test: testMacroDefinitionAndInvocation ---");
        Parser parser = Parser.fromSource("#define __MAX__(a, b) ((a) > (b) ? (a) : (b))\n"
                + "#define __LIMIT__ 100\n"
                + "#define __WRAP__ (x)\n"
                + "int main() { return __MAX__(1, __LIMIT__); }");
        CrustyFile file = parser.parse();

        MacroDefinitionNode max = assertInstanceOf(MacroDefinitionNode.class, file.items().get(0));
        assertEquals(MacroDelimiter.PARENS, max.delimiter());
        assertEquals(List.of("a", "b"), max.params());

        MacroDefinitionNode limit = (MacroDefinitionNode) file.items().get(1);
        assertEquals(MacroDelimiter.NONE, limit.delimiter());
        assertEquals(1, limit.body().size());

        MacroDefinitionNode wrap = (MacroDefinitionNode) file.items().get(2);
        assertEquals(MacroDelimiter.NONE, wrap.delimiter(), "a separated '(' starts the body, not a parameter list");
        assertEquals(3, wrap.body().size());

        assertEquals(3, parser.getMacroRegistry().size());
        assertTrue(parser.getMacroRegistry().isRegistered("__LIMIT__"));

        FunctionNode main = (FunctionNode) file.items().get(3);
        ReturnStatementNode ret = (ReturnStatementNode) main.body().statements().get(0);
        MacroCallNode call = assertInstanceOf(MacroCallNode.class, ret.value());
        assertEquals(MacroDelimiter.PARENS, call.delimiter());
        MacroCallNode bare = assertInstanceOf(MacroCallNode.class, call.arguments().get(1));
        assertEquals(MacroDelimiter.NONE, bare.delimiter());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUnregisteredMacroNames() {
        System.out.println("--- Running test: testUnregisteredMacroNames ---");
        assertInstanceOf(IdentifierNode.class, expression("__UNKNOWN__"));
        MacroCallNode call = assertInstanceOf(MacroCallNode.class, expression("__UNKNOWN__[1, 2]"));
        assertEquals(MacroDelimiter.BRACKETS, call.delimiter());
        assertEquals(2, call.arguments().size());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testMacroDelimiterMismatchFails() {
        System.out.println("--- Running test: testMacroDelimiterMismatchFails ---");
        String source = "#define __MAX__(a, b) a\nint main() { return __MAX__[1, 2]; }";

        ParseException exception = assertThrows(ParseException.class, () -> parse(source));
        System.out.println("Caught expected exception: " + exception.getMessage());
        assertEquals("macro '__MAX__' is defined with parentheses but invoked with brackets", exception.getReason());
        assertEquals(2, exception.getSpan().start().line());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testMacroNamingConvention() {
        System.out.println("--- Running test: testMacroNamingConvention ---");
        ParseException noPrefix = assertThrows(ParseException.class, () -> parse("#define MAX 10"));
        assertTrue(noPrefix.getReason().contains("double-underscore prefix"), noPrefix.getReason());
        assertEquals(List.of("__NAME__"), noPrefix.getExpected());

        ParseException noSuffix = assertThrows(ParseException.class, () -> parse("#define __MAX 10"));
        assertTrue(noSuffix.getReason().contains("double-underscore suffix"), noSuffix.getReason());

        CrustyFile ok = parse("#define __MAX__ 10");
        assertInstanceOf(MacroDefinitionNode.class, ok.items().get(0));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSyntaxErrorReportsExpectedToken() {
        System.out.println("--- Running test: testSyntaxErrorReportsExpectedToken ---");
        ParseException exception = assertThrows(ParseException.class, () -> parse("int main() { return 1 }"));
        System.out.println("Caught expected exception: " + exception.getMessage());

        assertTrue(exception.getMessage().startsWith("Syntax Error at 1:23"), exception.getMessage());
        assertEquals(List.of("';' after return"), exception.getExpected());
        assertEquals("'}'", exception.getFound());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testAttributesOnItemsAndMembers() {
        System.out.println("--- Running test: testAttributesOnItemsAndMembers ---");
        CrustyFile file = parse(String.join("\n",
                "#define __ONE__ 1",
                "#[derive(Debug, Clone)]",
                "struct Point {",
                "  #[serde(rename = \"x_pos\", skip = false)] int x;",
                "  int y;",
                "  #[inline] int sum(&self) { return self.x + self.y; }",
                "}",
                "#[repr(8)] enum Flag { On, Off }",
                "#[test] #[allow(dead_code)] static void check() { }"));

        assertEquals(4, file.items().size());
        assertInstanceOf(MacroDefinitionNode.class, file.items().get(0));

        StructNode point = (StructNode) file.items().get(1);
        assertEquals(List.of(new AttributeNode("derive", List.of(
                AttributeNode.Argument.identifier("Debug"), AttributeNode.Argument.identifier("Clone")))),
                point.attributes());
        assertEquals(List.of(new AttributeNode("serde", List.of(
                AttributeNode.Argument.nameValue("rename", LiteralNode.ofString("x_pos")),
                AttributeNode.Argument.nameValue("skip", LiteralNode.ofBool(false))))),
                point.fields().get(0).attributes());
        assertTrue(point.fields().get(1).attributes().isEmpty());
        assertEquals("inline", point.methods().get(0).attributes().get(0).name());

        EnumNode flag = (EnumNode) file.items().get(2);
        assertEquals(List.of(AttributeNode.Argument.literal(LiteralNode.ofInt(8))),
                flag.attributes().get(0).arguments());

        FunctionNode check = (FunctionNode) file.items().get(3);
        assertEquals(Visibility.PRIVATE, check.visibility());
        assertEquals(List.of("test", "allow"), check.attributes().stream().map(AttributeNode::name).toList());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testAttributesOnTypedefAreRejected() {
        System.out.println("--- Running test: testAttributesOnTypedefAreRejected ---");
        ParseException exception = assertThrows(ParseException.class, () -> parse("#[derive(Debug)] typedef int Id;"));
        assertEquals("Attributes cannot be applied to typedef", exception.getReason());

        ParseException badArgument = assertThrows(ParseException.class, () -> parse("#[repr(1.5)] enum E { A }"));
        assertEquals("Expected a literal in attribute", badArgument.getReason());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testOutOfRangeIntegersFail() {
        System.out.println("--- Running test: testOutOfRangeIntegersFail ---");
        ParseException discriminant = assertThrows(ParseException.class,
                () -> parse("enum Big { Huge = 99999999999999999999 }"));
        System.out.println("Caught expected exception: " + discriminant.getMessage());
        assertEquals(List.of("an integer in range (at most " + Long.MAX_VALUE + ")"), discriminant.getExpected());

        ParseException arraySize = assertThrows(ParseException.class,
                () -> parse("void f(int[3000000000] a) { }"));
        System.out.println("Caught expected exception: " + arraySize.getMessage());
        assertEquals(List.of("an integer in range (at most " + Integer.MAX_VALUE + ")"), arraySize.getExpected());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTopLevelGarbageFails() {
        System.out.println("--- Running test: testTopLevelGarbageFails ---");
        ParseException exception = assertThrows(ParseException.class, () -> parse("return 1;"));
        assertEquals("Expected a top-level item", exception.getReason());
        System.out.println("Result: Test PASSED.\n");
    }
}
