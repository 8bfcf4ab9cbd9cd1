package com.symdiff.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.symdiff.core.Expression;
import com.symdiff.core.ast.BinaryOpNode;
import com.symdiff.core.ast.ConstantNode;
import com.symdiff.core.ast.FunctionNode;
import com.symdiff.core.ast.NodeVisitor;
import com.symdiff.core.ast.VariableNode;

/**
 * 把表达式树转换为 JSON 对象。
 *
 * <p>每个节点都有 {@code type} 字段（constant / variable / binary / function），
 * 常量的值按数值域格式化为字符串。</p>
 */
public class AstJsonWriter<T> implements NodeVisitor<T, JsonObject> {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    public static <T> JsonObject toJson(Expression<T> expression) {
        return expression.getRoot().accept(new AstJsonWriter<T>());
    }

    public static String print(JsonObject document) {
        return GSON.toJson(document);
    }

    @Override
    public JsonObject visitConstant(ConstantNode<T> node) {
        JsonObject json = node("constant");
        json.addProperty("value", node.toString());
        return json;
    }

    @Override
    public JsonObject visitVariable(VariableNode<T> node) {
        JsonObject json = node("variable");
        json.addProperty("name", node.getName());
        return json;
    }

    @Override
    public JsonObject visitBinary(BinaryOpNode<T> node) {
        JsonObject json = node("binary");
        json.addProperty("operator", String.valueOf(node.getOperator().getSymbol()));
        json.add("left", node.getLeft().accept(this));
        json.add("right", node.getRight().accept(this));
        return json;
    }

    @Override
    public JsonObject visitFunction(FunctionNode<T> node) {
        JsonObject json = node("function");
        json.addProperty("name", node.getFunction().getFunctionName());
        json.add("argument", node.getArgument().accept(this));
        return json;
    }

    private static JsonObject node(String type) {
        JsonObject json = new JsonObject();
        json.addProperty("type", type);
        return json;
    }
}
