package org.csu.handc.common.exception;

import lombok.Getter;
import org.csu.handc.compiler.semantic.SemanticError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @author hidyouth
 * @description: 语义分析阶段的自定义异常，携带本次分析发现的全部错误
 */
@Getter
public class SemanticException extends RuntimeException {

    private final List<SemanticError> errors;

    public SemanticException(List<SemanticError> errors) {
        super("Semantic analysis failed: " + errors.stream()
                .map(SemanticError::message)
                .collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }
}
