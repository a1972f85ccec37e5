package org.csu.handc.compiler.semantic;

/**
 * 一条语义错误。目前只有“使用未声明的变量”一种。
 *
 * @param kind 错误种类
 * @param name 出错的变量名
 */
public record SemanticError(Kind kind, String name) {

    public enum Kind {
        UNDECLARED_VARIABLE
    }

    public static SemanticError undeclaredVariable(String name) {
        return new SemanticError(Kind.UNDECLARED_VARIABLE, name);
    }

    public String message() {
        return "Use of undeclared variable '" + name + "'";
    }
}
