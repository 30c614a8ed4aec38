package edu.isi.ccglex;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

public class CategoryTokenizerTest {
  @Test
  public void testPrimitiveAtom() throws Exception {
    Pair<String, String> p = CategoryTokenizer.nextCategory("NP[sg]/N[sg]");
    assertThat(p.l()).isEqualTo("NP[sg]");
    assertThat(p.r()).isEqualTo("/N[sg]");
  }

  @Test
  public void testGroupAtom() throws Exception {
    Pair<String, String> p = CategoryTokenizer.nextCategory("(S\\NP)/NP");
    assertThat(p.l()).isEqualTo("(S\\NP)");
    assertThat(p.r()).isEqualTo("/NP");
  }

  @Test
  public void testBadAtom() {
    assertThatThrownBy(() -> CategoryTokenizer.nextCategory("/N"))
        .isInstanceOf(MalformedCategoryException.class);
    assertThatThrownBy(() -> CategoryTokenizer.nextCategory(""))
        .isInstanceOf(MalformedCategoryException.class)
        .hasMessageContaining("end of the text");
  }

  @Test
  public void testSplitPrimitive() throws Exception {
    Pair<String, String> p = CategoryTokenizer.splitPrimitive("N[sg,pl]");
    assertThat(p.l()).isEqualTo("N");
    assertThat(p.r()).isEqualTo("[sg,pl]");
    assertThat(CategoryTokenizer.splitPrimitive("NP").r()).isNull();
  }

  @Test
  public void testApplication() throws Exception {
    Pair<Direction, String> p = CategoryTokenizer.nextApplication("\\.,NP");
    assertThat(p.l().isBackward()).isTrue();
    assertThat(p.l().restrictions()).isEqualTo(".,");
    assertThat(p.r()).isEqualTo("NP");
  }

  @Test
  public void testPlainApplication() throws Exception {
    Pair<Direction, String> p = CategoryTokenizer.nextApplication("/(S/NP)");
    assertThat(p.l().isForward()).isTrue();
    assertThat(p.l().restrictions()).isEmpty();
    assertThat(p.r()).isEqualTo("(S/NP)");
  }

  @Test
  public void testMissingApplication() {
    assertThatThrownBy(() -> CategoryTokenizer.nextApplication(" N"))
        .isInstanceOf(MalformedCategoryException.class);
  }

  @Test
  public void testSubscripts() {
    assertThat(CategoryTokenizer.parseSubscripts("[sg,pl,sg]")).containsExactly("sg", "pl", "sg");
    assertThat(CategoryTokenizer.parseSubscripts(null)).isEmpty();
  }
}
