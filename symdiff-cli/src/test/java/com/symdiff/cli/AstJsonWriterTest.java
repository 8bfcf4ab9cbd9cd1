package com.symdiff.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.symdiff.core.SymbolicEngine;
import com.symdiff.core.domain.ComplexDomain;
import com.symdiff.core.domain.RealDomain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AstJsonWriter 测试")
class AstJsonWriterTest {

    @Test
    @DisplayName("二元运算节点")
    void testBinary() {
        JsonObject json = AstJsonWriter.toJson(SymbolicEngine.parse("x + 2.5", RealDomain.INSTANCE));

        assertThat(json.get("type").getAsString()).isEqualTo("binary");
        assertThat(json.get("operator").getAsString()).isEqualTo("+");
        JsonObject left = json.getAsJsonObject("left");
        assertThat(left.get("type").getAsString()).isEqualTo("variable");
        assertThat(left.get("name").getAsString()).isEqualTo("x");
        JsonObject right = json.getAsJsonObject("right");
        assertThat(right.get("type").getAsString()).isEqualTo("constant");
        assertThat(right.get("value").getAsString()).isEqualTo("2.5");
    }

    @Test
    @DisplayName("函数节点")
    void testFunction() {
        JsonObject json = AstJsonWriter.toJson(SymbolicEngine.parse("sin(x ^ 2)", RealDomain.INSTANCE));

        assertThat(json.get("type").getAsString()).isEqualTo("function");
        assertThat(json.get("name").getAsString()).isEqualTo("sin");
        JsonObject argument = json.getAsJsonObject("argument");
        assertThat(argument.get("operator").getAsString()).isEqualTo("^");
    }

    @Test
    @DisplayName("复数常量按数值域格式化")
    void testComplexConstant() {
        JsonObject json = AstJsonWriter.toJson(
                SymbolicEngine.parse("x", ComplexDomain.INSTANCE).diff("x"));
        assertThat(json.get("type").getAsString()).isEqualTo("constant");
        assertThat(json.get("value").getAsString()).isEqualTo("1");
    }

    @Test
    @DisplayName("输出可以被重新解析")
    void testPrintParsesBack() {
        JsonObject json = AstJsonWriter.toJson(SymbolicEngine.parse("a ^ b", RealDomain.INSTANCE));
        String printed = AstJsonWriter.print(json);

        assertThat(printed).contains("\"operator\": \"^\"");
        assertThat(JsonParser.parseString(printed).getAsJsonObject()).isEqualTo(json);
    }
}
