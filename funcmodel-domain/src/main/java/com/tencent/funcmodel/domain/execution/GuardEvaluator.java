package com.tencent.funcmodel.domain.execution;

import com.tencent.funcmodel.domain.node.ActionNode;
import com.tencent.funcmodel.domain.shared.Result;

import java.util.Map;

/**
 * GuardEvaluator - 条件执行的守卫表达式求值器
 */
public interface GuardEvaluator {

    /**
     * 校验表达式能否被解析，规划阶段调用
     */
    Result<Void> validate(String expression);

    /**
     * 求值守卫表达式，求值出错视为 false
     *
     * @param expression 守卫表达式
     * @param node       被守卫的动作
     * @param variables  执行请求中的变量
     * @param statuses   动作名称 -> 当前运行状态
     */
    boolean evaluate(String expression, ActionNode node, Map<String, Object> variables, Map<String, String> statuses);
}
