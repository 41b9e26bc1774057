package org.studyhub.studyindex.filter;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FilterTest {

    @Test
    void equalsCompilesToEqOperator() {
        assertEquals(Map.of("course_id", Map.of("$eq", "CS101")), Filter.eq("course_id", "CS101").toWhere());
    }

    @Test
    void inCompilesToInOperator() {
        assertEquals(Map.of("course_id", Map.of("$in", List.of("CS101", "CS102"))),
                Filter.in("course_id", List.of("CS101", "CS102")).toWhere());
    }

    @Test
    void andCombinesCompiledOperands() {
        Map<String, Object> where = Filter.and(Filter.eq("user_id", "u1"), Filter.in("resource_id", List.of("r1"))).toWhere();

        assertEquals(Map.of("$and", List.of(
                Map.of("user_id", Map.of("$eq", "u1")),
                Map.of("resource_id", Map.of("$in", List.of("r1"))))), where);
    }

    @Test
    void singleOperandLogicalFilterCollapsesToOperand() {
        assertEquals(Map.of("assignment_id", Map.of("$eq", "A1")),
                Filter.anyOf("assignment_id", List.of("A1")).toWhere());
    }

    @Test
    void anyOfBuildsOrOverEquals() {
        assertEquals(Map.of("$or", List.of(
                Map.of("assignment_id", Map.of("$eq", "A1")),
                Map.of("assignment_id", Map.of("$eq", "A2")))),
                Filter.anyOf("assignment_id", List.of("A1", "A2")).toWhere());
    }

    @Test
    void anyOfSkipsNullAndBlankValues() {
        assertEquals(Map.of("course_id", Map.of("$eq", "CS101")),
                Filter.anyOf("course_id", Arrays.asList(null, "CS101", "  ")).toWhere());
    }

    @Test
    void anyOfWithoutUsableValuesIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Filter.anyOf("course_id", Arrays.asList(null, "")));
        assertThrows(IllegalArgumentException.class, () -> Filter.anyOf("course_id", List.of()));
    }

    @Test
    void bothToleratesMissingSides() {
        Filter user = Filter.eq("user_id", "u1");

        assertEquals(user, Filter.both(null, user));
        assertEquals(user, Filter.both(user, null));
        assertEquals(new Filter.And(List.of(user, user)), Filter.both(user, user));
    }

    @Test
    void rejectsEmptyOperands() {
        assertThrows(IllegalArgumentException.class, () -> Filter.in("course_id", List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Filter.Or(List.of()));
        assertThrows(IllegalArgumentException.class, Filter::and);
        assertThrows(IllegalArgumentException.class, () -> Filter.eq(" ", "x"));
    }
}
