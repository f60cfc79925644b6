package com.tencent.funcmodel.domain.execution.impl;

import com.tencent.funcmodel.domain.execution.GuardEvaluator;
import com.tencent.funcmodel.domain.node.ActionNode;
import com.tencent.funcmodel.domain.shared.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * 基于 Spring Expression Language 的守卫求值器。
 * <p>
 * 表达式中可用的变量: #variables（请求变量）、#statuses（动作名称 -> 运行状态）、#node（当前动作）。
 * 示例: "#variables['amount'] > 100 and #statuses['Review'] == 'completed'"
 * </p>
 */
@Slf4j
@Component
public class SpelGuardEvaluator implements GuardEvaluator {

    private final ExpressionParser parser = new SpelExpressionParser();

    @Override
    public Result<Void> validate(String expression) {
        if (expression == null || expression.isBlank()) {
            return Result.fail("Guard expression cannot be empty");
        }
        try {
            parser.parseExpression(expression);
            return Result.ok();
        } catch (ParseException e) {
            return Result.fail("Invalid guard expression [" + expression + "]: " + e.getMessage());
        }
    }

    @Override
    public boolean evaluate(String expression, ActionNode node, Map<String, Object> variables,
                            Map<String, String> statuses) {
        if (expression == null || expression.isBlank()) {
            return false;
        }
        StandardEvaluationContext context = createEvaluationContext(node, variables, statuses);
        try {
            Expression exp = parser.parseExpression(expression);
            Boolean result = exp.getValue(context, Boolean.class);
            return result != null && result;
        } catch (Exception e) {
            log.warn("Guard evaluation failed for action [{}]: [{}]", node.getNodeId(), expression, e);
            return false;
        }
    }

    @NonNull
    private StandardEvaluationContext createEvaluationContext(ActionNode node, Map<String, Object> variables,
                                                              Map<String, String> statuses) {
        StandardEvaluationContext context = new StandardEvaluationContext();
        Map<String, Object> root = new HashMap<>();
        root.put("variables", variables);
        root.put("statuses", statuses);
        root.put("node", node);
        context.setRootObject(root);
        context.setVariable("variables", variables);
        context.setVariable("statuses", statuses);
        context.setVariable("node", node);
        return context;
    }
}
