package com.tencent.funcmodel.domain.model;

import com.tencent.funcmodel.domain.shared.Result;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * ModelPermissions - 模型权限 {owner, editors, viewers}
 * <p>
 * 只是数据，不在领域内做鉴权；编辑者隐含查看权限。
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ModelPermissions {

    private final String owner;
    private final List<String> editors;
    private final List<String> viewers;

    private ModelPermissions(String owner, List<String> editors, List<String> viewers) {
        this.owner = owner;
        this.editors = editors;
        this.viewers = viewers;
    }

    public static Result<ModelPermissions> create(String owner, List<String> editors, List<String> viewers) {
        if (owner == null || owner.isBlank()) {
            return Result.fail("Model owner cannot be empty");
        }
        return Result.ok(new ModelPermissions(owner.trim(), distinct(editors), distinct(viewers)));
    }

    public static Result<ModelPermissions> ownedBy(String owner) {
        return create(owner, null, null);
    }

    public boolean canEdit(String user) {
        return owner.equals(user) || editors.contains(user);
    }

    public boolean canView(String user) {
        return canEdit(user) || viewers.contains(user);
    }

    private static List<String> distinct(List<String> users) {
        if (users == null) {
            return Collections.emptyList();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String user : users) {
            if (user != null && !user.isBlank()) {
                unique.add(user.trim());
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(unique));
    }
}
