package edu.isi.ccglex;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class CategoryParserTest {
  private List<String> primitives;
  private Map<String, Family> families;

  @BeforeEach
  public void setUp() {
    primitives = Arrays.asList("S", "NP", "N", "A", "B", "C");
    families = new HashMap<>();
  }

  private Category parse(String text) throws DataFormatException {
    return CategoryParser.parseCategory(text, primitives, families);
  }

  private void define(String name, String text) throws DataFormatException {
    Pair<Category, UnificationVariable> p = CategoryParser.augParseCategory(text, primitives, families, null);
    families.put(name, new Family(name, p.l(), p.r()));
  }

  @Test
  public void testPrimitive() throws Exception {
    assertThat(parse("N[sg,pl]")).isEqualTo(new PrimitiveCategory("N", Arrays.asList("sg", "pl")));
  }

  @Test
  public void testDuplicateSubscriptsKept() throws Exception {
    PrimitiveCategory n = (PrimitiveCategory) parse("N[pl,sg,pl]");
    assertThat(n.name()).isEqualTo("N");
    assertThat(n.subscripts()).containsExactly("pl", "sg", "pl");
  }

  @Test
  public void testLeftAssociative() throws Exception {
    FunctionalCategory abc = (FunctionalCategory) parse("A/B/C");
    assertThat(abc.argument()).isEqualTo(new PrimitiveCategory("C"));
    assertThat(abc.result()).isEqualTo(parse("A/B"));
    assertThat(abc).hasToString("(A/B)/C");
  }

  @Test
  public void testBracketsGroupArgument() throws Exception {
    FunctionalCategory abc = (FunctionalCategory) parse("A/(B/C)");
    assertThat(abc.result()).isEqualTo(new PrimitiveCategory("A"));
    assertThat(abc.argument()).isEqualTo(parse("B/C"));
    assertThat(abc).hasToString("A/(B/C)");
  }

  @Test
  public void testRedundantBrackets() throws Exception {
    assertThat(parse("((S\\NP))")).isEqualTo(parse("S\\NP"));
  }

  @Test
  public void testModifiers() throws Exception {
    FunctionalCategory f = (FunctionalCategory) parse("S\\.,NP");
    assertThat(f.direction().isBackward()).isTrue();
    assertThat(f.direction().restrictions()).isEqualTo(".,");
    assertThat(f.direction().canCompose()).isFalse();
  }

  @Test
  public void testVarSharedWithinCategory() throws Exception {
    Pair<Category, UnificationVariable> p =
        CategoryParser.augParseCategory("(var\\var)/var", primitives, families, null);
    FunctionalCategory top = (FunctionalCategory) p.l();
    FunctionalCategory inner = (FunctionalCategory) top.result();
    assertThat(p.r()).isNotNull();
    assertThat(top.argument()).isSameAs(p.r());
    assertThat(inner.result()).isSameAs(p.r());
    assertThat(inner.argument()).isSameAs(p.r());
  }

  @Test
  public void testVarsDifferAcrossParses() throws Exception {
    Category a = parse("var");
    Category b = parse("var");
    assertThat(a.isVariable()).isTrue();
    assertThat(a).isNotEqualTo(b);
  }

  @Test
  public void testNoVarLeavesBindingEmpty() throws Exception {
    assertThat(CategoryParser.augParseCategory("S\\NP", primitives, families, null).r()).isNull();
  }

  @Test
  public void testFamilyExpands() throws Exception {
    define("Det", "NP/N");
    assertThat(parse("Det")).isEqualTo(parse("NP/N"));
    assertThat(parse("Det")).isEqualTo(parse("Det"));
    assertThat(parse("(S/Det)")).hasToString("S/(NP/N)");
  }

  @Test
  public void testFamilyVariableAdopted() throws Exception {
    define("Conj", "(var\\var)/var");
    UnificationVariable stored = families.get("Conj").variable();
    Pair<Category, UnificationVariable> p = CategoryParser.augParseCategory("Conj", primitives, families, null);
    assertThat(p.r()).isSameAs(stored);
    assertThat(p.l()).isSameAs(families.get("Conj").category());
  }

  @Test
  public void testFamilyVariableRenamed() throws Exception {
    define("Conj", "(var\\var)/var");
    Family conj = families.get("Conj");
    Pair<Category, UnificationVariable> p = CategoryParser.augParseCategory("var/Conj", primitives, families, null);
    UnificationVariable fresh = p.r();
    assertThat(fresh).isNotSameAs(conj.variable());

    FunctionalCategory top = (FunctionalCategory) p.l();
    assertThat(top.result()).isSameAs(fresh);
    FunctionalCategory expanded = (FunctionalCategory) top.argument();
    assertThat(expanded.argument()).isSameAs(fresh);
    assertThat(((FunctionalCategory) expanded.result()).result()).isSameAs(fresh);

    // the stored template still uses its own variable
    FunctionalCategory template = (FunctionalCategory) conj.category();
    assertThat(template.argument()).isSameAs(conj.variable());
  }

  @Test
  public void testFamilyIgnoresSubscripts() throws Exception {
    define("Det", "NP/N");
    assertThat(parse("Det[sg]")).isEqualTo(parse("NP/N"));
  }

  @Test
  public void testSubscriptedVarIsName() {
    assertThatThrownBy(() -> parse("var[sg]"))
        .isInstanceOf(UnknownCategoryNameException.class);
  }

  @Test
  public void testUnknownName() {
    UnknownCategoryNameException e =
        catchThrowableOfType(() -> parse("S\\VP"), UnknownCategoryNameException.class);
    assertThat(e).hasMessageContaining("VP");
    assertThat(e.getName()).isEqualTo("VP");
  }

  @Test
  public void testUnbalanced() {
    assertThatThrownBy(() -> parse("NP/(N"))
        .isInstanceOf(MalformedCategoryException.class);
  }

  @Test
  public void testTrailingOperator() {
    assertThatThrownBy(() -> parse("NP/"))
        .isInstanceOf(MalformedCategoryException.class);
  }

  @Test
  public void testMissingOperator() {
    assertThatThrownBy(() -> parse("NP N"))
        .isInstanceOf(MalformedCategoryException.class);
    assertThatThrownBy(() -> parse("NP)"))
        .isInstanceOf(MalformedCategoryException.class);
  }

  @Test
  public void testEmptyGroup() {
    assertThatThrownBy(() -> parse("S/()"))
        .isInstanceOf(MalformedCategoryException.class);
  }
}
