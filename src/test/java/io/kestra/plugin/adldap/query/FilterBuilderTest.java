package io.kestra.plugin.adldap.query;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalToIgnoringCase;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FilterBuilderTest {
    @Test
    void no_predicate_renders_empty() {
        assertThat(new FilterBuilder().render(), is(""));
        assertThat(new FilterBuilder().hasPredicates(), is(false));
    }

    @Test
    void single_predicate_is_not_grouped() {
        FilterBuilder builder = new FilterBuilder()
            .addPredicate("cn", Operator.EQUALS, "John Doe", BooleanOperator.OR);

        assertThat(builder.render(), is("(cn=John Doe)"));
    }

    @Test
    void same_boolean_is_batched() {
        FilterBuilder builder = new FilterBuilder()
            .addPredicate("objectcategory", Operator.EQUALS, "person", BooleanOperator.AND)
            .addPredicate("department", Operator.EQUALS, "Sales", BooleanOperator.AND)
            .addPredicate("mail", Operator.HAS, null, BooleanOperator.AND);

        assertThat(builder.render(), is("(&(objectcategory=person)(department=Sales)(mail=*))"));
    }

    @Test
    void boolean_change_nests_previous_group() {
        FilterBuilder andThenOr = new FilterBuilder()
            .addPredicate("a", Operator.EQUALS, "1", BooleanOperator.AND)
            .addPredicate("b", Operator.EQUALS, "2", BooleanOperator.AND)
            .addPredicate("c", Operator.EQUALS, "3", BooleanOperator.OR);
        assertThat(andThenOr.render(), is("(|(&(a=1)(b=2))(c=3))"));

        FilterBuilder orThenAnd = new FilterBuilder()
            .addPredicate("a", Operator.EQUALS, "1", BooleanOperator.AND)
            .addPredicate("b", Operator.EQUALS, "2", BooleanOperator.OR)
            .addPredicate("c", Operator.EQUALS, "3", BooleanOperator.AND)
            .addPredicate("d", Operator.EQUALS, "4", BooleanOperator.AND);
        assertThat(orThenAnd.render(), is("(&(|(a=1)(b=2))(c=3)(d=4))"));
    }

    @Test
    void first_boolean_is_ignored() {
        FilterBuilder builder = new FilterBuilder()
            .addPredicate("a", Operator.EQUALS, "1", BooleanOperator.OR)
            .addPredicate("b", Operator.EQUALS, "2", BooleanOperator.AND);

        assertThat(builder.render(), is("(&(a=1)(b=2))"));
    }

    @Test
    void operators() {
        assertThat(predicate("cn", Operator.NOT_EQUALS, "x"), is("(!(cn=x))"));
        assertThat(predicate("cn", Operator.CONTAINS, "oh"), is("(cn=*oh*)"));
        assertThat(predicate("cn", Operator.STARTS_WITH, "Jo"), is("(cn=Jo*)"));
        assertThat(predicate("cn", Operator.ENDS_WITH, "oe"), is("(cn=*oe)"));
        assertThat(predicate("mail", Operator.WILDCARD, null), is("(mail=*)"));
        assertThat(predicate("mail", Operator.NOT_HAS, null), is("(!(mail=*))"));
        assertThat(predicate("pwdlastset", Operator.GREATER_THAN_OR_EQUALS, "10"), is("(pwdlastset>=10)"));
        assertThat(predicate("pwdlastset", Operator.LESS_THAN_OR_EQUALS, "10"), is("(pwdlastset<=10)"));
        assertThat(predicate("sn", Operator.APPROXIMATELY, "Do"), is("(sn~=Do)"));
    }

    @Test
    void empty_partial_match_means_presence() {
        assertThat(predicate("cn", Operator.CONTAINS, ""), is("(cn=*)"));
        assertThat(predicate("cn", Operator.STARTS_WITH, null), is("(cn=*)"));
    }

    @Test
    void values_are_escaped() {
        assertThat(predicate("cn", Operator.EQUALS, "a*b(c)\\d"), equalToIgnoringCase("(cn=a\\2ab\\28c\\29\\5cd)"));
        assertThat(predicate("cn", Operator.CONTAINS, "*"), equalToIgnoringCase("(cn=*\\2a*)"));
        assertThat(Predicate.escape("plain"), is("plain"));
        assertThat(predicate("cn", Operator.EQUALS, "a\u0000b"), equalToIgnoringCase("(cn=a\\00b)"));
    }

    @Test
    void render_is_idempotent() {
        FilterBuilder builder = new FilterBuilder()
            .addPredicate("objectcategory", Operator.EQUALS, "person", BooleanOperator.AND)
            .addPredicate("cn", Operator.CONTAINS, "o(h)", BooleanOperator.OR)
            .addRawFilter("(mail=*)", BooleanOperator.AND);

        String first = builder.render();

        assertThat(builder.render(), is(first));
        assertThat(builder.render(), equalToIgnoringCase("(&(|(objectcategory=person)(cn=*o\\28h\\29*))(mail=*))"));
    }

    @Test
    void missing_field_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Predicate.escape(null));
        assertThrows(IllegalArgumentException.class, () -> predicate(null, Operator.EQUALS, "x"));
    }

    @Test
    void raw_clauses() {
        FilterBuilder builder = new FilterBuilder()
            .addPredicate("objectcategory", Operator.EQUALS, "group", BooleanOperator.AND)
            .addRawFilter("memberOf:1.2.840.113556.1.4.1941:=CN=Admins,DC=acme,DC=org", BooleanOperator.AND);

        assertThat(builder.render(), is("(&(objectcategory=group)(memberOf:1.2.840.113556.1.4.1941:=CN=Admins,DC=acme,DC=org))"));
        assertThat(predicate(null, Operator.RAW, "(|(a=1)(b=2))"), is("(|(a=1)(b=2))"));

        assertThrows(IllegalArgumentException.class, () -> predicate(null, Operator.RAW, "(a=1"));
        assertThrows(IllegalArgumentException.class, () -> predicate(null, Operator.RAW, " "));
    }

    @Test
    void wildcard_defaults_to_object_class() {
        assertThat(new FilterBuilder().addWildcard().render(), is("(objectclass=*)"));
    }

    @Test
    void selects_are_deduplicated_ignoring_case() {
        FilterBuilder builder = new FilterBuilder()
            .select(List.of("cn", "Mail", "CN", " mail ", ""))
            .select("sAMAccountName");

        assertThat(builder.getSelects(), contains("cn", "Mail", "sAMAccountName"));
    }

    @Test
    void operator_symbols() {
        assertThat(Operator.fromSymbol("="), is(Operator.EQUALS));
        assertThat(Operator.fromSymbol("!*"), is(Operator.NOT_HAS));
        assertThat(Operator.fromSymbol("starts_with"), is(Operator.STARTS_WITH));
        assertThat(Operator.fromSymbol("GREATER_THAN_OR_EQUALS"), is(Operator.GREATER_THAN_OR_EQUALS));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Operator.fromSymbol("=="));
        assertThat(e.getMessage(), is("Unknown operator \"==\"."));
    }

    private static String predicate(String field, Operator operator, String value) {
        return Predicate.builder().field(field).operator(operator).value(value).build().toFilter();
    }
}
