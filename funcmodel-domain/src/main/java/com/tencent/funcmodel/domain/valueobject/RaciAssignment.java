package com.tencent.funcmodel.domain.valueobject;

import com.tencent.funcmodel.domain.shared.Result;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * RaciAssignment - 动作节点的 RACI 分配
 * <p>
 * responsible 与 accountable 至多各一人，consulted/informed 可以为多人。
 * 同一人不能同时出现在 consulted 与 informed 中。
 * </p>
 */
@ToString
@EqualsAndHashCode
public final class RaciAssignment {

    private static final RaciAssignment EMPTY =
            new RaciAssignment(null, null, Collections.emptyList(), Collections.emptyList());

    private final String responsible;
    private final String accountable;
    private final List<String> consulted;
    private final List<String> informed;

    private RaciAssignment(String responsible, String accountable, List<String> consulted, List<String> informed) {
        this.responsible = responsible;
        this.accountable = accountable;
        this.consulted = consulted;
        this.informed = informed;
    }

    public static Result<RaciAssignment> create(String responsible, String accountable,
                                                List<String> consulted, List<String> informed) {
        List<String> consultedList = normalize(consulted);
        List<String> informedList = normalize(informed);
        for (String person : consultedList) {
            if (informedList.contains(person)) {
                return Result.fail("A person cannot be both consulted and informed: " + person);
            }
        }
        return Result.ok(new RaciAssignment(trimToNull(responsible), trimToNull(accountable),
                Collections.unmodifiableList(consultedList), Collections.unmodifiableList(informedList)));
    }

    public static RaciAssignment empty() {
        return EMPTY;
    }

    public String getResponsible() {
        return responsible;
    }

    public String getAccountable() {
        return accountable;
    }

    public List<String> getConsulted() {
        return consulted;
    }

    public List<String> getInformed() {
        return informed;
    }

    public boolean hasRole(String person, RaciRole role) {
        return getRolesOf(person).contains(role);
    }

    public Set<RaciRole> getRolesOf(String person) {
        Set<RaciRole> roles = EnumSet.noneOf(RaciRole.class);
        if (person == null) {
            return roles;
        }
        String key = person.trim();
        if (key.equals(responsible)) {
            roles.add(RaciRole.RESPONSIBLE);
        }
        if (key.equals(accountable)) {
            roles.add(RaciRole.ACCOUNTABLE);
        }
        if (consulted.contains(key)) {
            roles.add(RaciRole.CONSULTED);
        }
        if (informed.contains(key)) {
            roles.add(RaciRole.INFORMED);
        }
        return roles;
    }

    private static List<String> normalize(List<String> people) {
        if (people == null) {
            return new ArrayList<>();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String person : people) {
            String trimmed = trimToNull(person);
            if (trimmed != null) {
                unique.add(trimmed);
            }
        }
        return new ArrayList<>(unique);
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
