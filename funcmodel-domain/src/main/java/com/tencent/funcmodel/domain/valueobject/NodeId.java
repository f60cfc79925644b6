package com.tencent.funcmodel.domain.valueobject;

import com.tencent.funcmodel.domain.shared.IdGenerator;
import com.tencent.funcmodel.domain.shared.Result;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * NodeId - 节点标识
 * <p>
 * UUID v4 格式，大小写均可接受，比较时忽略大小写（内部统一为小写）。
 * 模型 ID 使用同样的格式，因此也复用本类做校验。
 * </p>
 *
 * @author funcmodel
 */
public final class NodeId {

    private static final Pattern UUID_V4 = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$");

    private final String value;

    private NodeId(String value) {
        this.value = value;
    }

    public static Result<NodeId> create(String value) {
        if (value == null || value.isBlank()) {
            return Result.fail("Node id cannot be empty");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (!UUID_V4.matcher(normalized).matches()) {
            return Result.fail("Invalid node id format, expected UUID v4: " + value);
        }
        return Result.ok(new NodeId(normalized));
    }

    public static NodeId generate(IdGenerator idGenerator) {
        Result<NodeId> result = create(idGenerator.nextId());
        if (result.isFailure()) {
            throw new IllegalStateException("Id generator produced an invalid id: " + result.getError());
        }
        return result.getValue();
    }

    /**
     * 判断字符串是否为合法的 UUID v4
     */
    public static boolean isValid(String value) {
        return value != null && UUID_V4.matcher(value.trim().toLowerCase(Locale.ROOT)).matches();
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NodeId)) {
            return false;
        }
        return value.equals(((NodeId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
