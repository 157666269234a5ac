package com.flowcheck.core.parser;

import com.flowcheck.core.parser.ast.AstWalker;
import com.flowcheck.core.parser.ast.PythonAst.Call;
import com.flowcheck.core.parser.ast.PythonAst.ClassDef;
import com.flowcheck.core.parser.ast.PythonAst.Compare;
import com.flowcheck.core.parser.ast.PythonAst.Constant;
import com.flowcheck.core.parser.ast.PythonAst.DictExpr;
import com.flowcheck.core.parser.ast.PythonAst.Expr;
import com.flowcheck.core.parser.ast.PythonAst.ExprStmt;
import com.flowcheck.core.parser.ast.PythonAst.FunctionDef;
import com.flowcheck.core.parser.ast.PythonAst.ImportFrom;
import com.flowcheck.core.parser.ast.PythonAst.Module;
import com.flowcheck.core.parser.ast.PythonAst.TupleExpr;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PythonParser}.
 */
class PythonParserTest {

    @Test
    void parse_addNodeCall_exposesMethodArgumentsAndDict() {
        Module module = PythonParser.parse("""
            workflow = WorkflowBuilder()
            workflow.add_node("LLMAgentNode", "agent", {"model": "gpt-4", "temperature": 0.2})
            """);

        assertThat(module.body()).hasSize(2);
        ExprStmt statement = (ExprStmt) module.body().get(1);
        Call call = (Call) statement.value();
        assertThat(call.methodName()).isEqualTo("add_node");
        assertThat(call.line()).isEqualTo(2);
        assertThat(call.args()).hasSize(3);
        assertThat(call.args().get(0)).isInstanceOf(Constant.class);
        DictExpr config = (DictExpr) call.args().get(2);
        assertThat(config.keys()).hasSize(2);
    }

    @Test
    void parse_numericLiterals_useWidestNeededType() {
        Module module = PythonParser.parse("values = [7, 123456789012345678901234567890, 2.5, 0x1F]\n");

        List<Object> values = AstWalker.collect(module, Constant.class).stream().map(Constant::value).toList();
        assertThat(values).containsExactly(7L, new BigInteger("123456789012345678901234567890"), 2.5, 31L);
    }

    @Test
    void parse_nodeClass_exposesMethodsAndBases() {
        Module module = PythonParser.parse("""
            from kailash.nodes.base import Node, NodeParameter

            @register_node()
            class SummaryNode(Node):
                \"\"\"Summarizes text.\"\"\"

                def get_parameters(self) -> dict:
                    return {"text": NodeParameter(name="text", type=str, required=True)}

                async def run(self, *, text: str = "", **kwargs):
                    async with session() as client:
                        reply = await client.post(f"{BASE}/summarize", json={"text": text})
                    return {"result": reply}
            """);

        ImportFrom importFrom = (ImportFrom) module.body().get(0);
        assertThat(importFrom.module()).isEqualTo("kailash.nodes.base");
        assertThat(importFrom.names()).hasSize(2);

        ClassDef classDef = AstWalker.collect(module, ClassDef.class).get(0);
        assertThat(classDef.name()).isEqualTo("SummaryNode");
        assertThat(classDef.line()).isEqualTo(4);
        assertThat(classDef.method("get_parameters")).isNotNull();
        FunctionDef run = AstWalker.collect(module, FunctionDef.class).stream()
            .filter(def -> def.name().equals("run"))
            .findFirst()
            .orElseThrow();
        assertThat(run.async()).isTrue();
        assertThat(run.arguments().parameters()).extracting(p -> p.name()).containsExactly("self", "text", "kwargs");
    }

    @Test
    void parse_controlFlowAndComprehensions_succeeds() {
        Module module = PythonParser.parse("""
            try:
                rows = [r for r in fetch() if r]
                lookup = {k: v for k, v in rows}
            except (ValueError, KeyError) as error:
                raise RuntimeError("bad rows") from error
            finally:
                close()

            while (n := next_value()) is not None:
                total += n
            else:
                pass

            handler = lambda item, *rest, scale=2: item * scale
            """);

        assertThat(module.body()).hasSize(3);
    }

    @Test
    void parse_invalidSyntax_reportsLineAndColumn() {
        assertThatThrownBy(() -> PythonParser.parse("""
            workflow = WorkflowBuilder()
            def broken(:
                pass
            """))
            .isInstanceOf(PythonSyntaxException.class)
            .satisfies(e -> {
                PythonSyntaxException error = (PythonSyntaxException) e;
                assertThat(error.getLine()).isEqualTo(2);
                assertThat(error.getColumn()).isPositive();
            });
    }

    @Test
    void parse_missingIndentedBlock_throwsSyntaxError() {
        assertThatThrownBy(() -> PythonParser.parse("if ready:\nrun()\n"))
            .isInstanceOf(PythonSyntaxException.class)
            .hasMessage("expected an indented block");
    }

    @Test
    void parse_assignmentToLiteral_throwsSyntaxError() {
        assertThatThrownBy(() -> PythonParser.parse("5 = x\n"))
            .isInstanceOf(PythonSyntaxException.class)
            .hasMessageStartingWith("cannot assign to");
    }

    @Test
    void parse_emptySource_returnsEmptyModule() {
        assertThat(PythonParser.parse("").body()).isEmpty();
        assertThat(PythonParser.parse("# only a comment\n\n").body()).isEmpty();
    }

    @Test
    void parseExpression_comparison_returnsCompare() {
        Expr expr = PythonParser.parseExpression("  quality >= 0.9  ");

        assertThat(expr).isInstanceOf(Compare.class);
        assertThat(((Compare) expr).ops()).containsExactly(">=");
    }

    @Test
    void parseExpression_bareTuple_returnsTuple() {
        assertThat(PythonParser.parseExpression("a, b")).isInstanceOf(TupleExpr.class);
    }

    @Test
    void parseExpression_statementText_throwsSyntaxError() {
        assertThatThrownBy(() -> PythonParser.parseExpression("x = 1"))
            .isInstanceOf(PythonSyntaxException.class);
        assertThatThrownBy(() -> PythonParser.parseExpression(""))
            .isInstanceOf(PythonSyntaxException.class);
    }
}
