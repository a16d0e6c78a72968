package com.gentoro.usagereporting.schema;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LexicalSignatureCalculatorTest {

  private final LexicalSignatureCalculator calculator = new LexicalSignatureCalculator();

  private static OperationDocument doc(String source) {
    return () -> source;
  }

  @Test
  @DisplayName("Drops aliases, hides literals and keeps only reachable fragments")
  void normalizesOperation() {
    String source =
        "query Q($id: ID!, $n: Int = 5) {\n"
            + "  u: user(id: $id, name: \"bob\") { name ...F }\n"
            + "}\n"
            + "fragment F on User { age }\n"
            + "fragment Unused on User { email }\n";

    assertEquals(
        "query Q($id:ID!,$n:Int=0){user(id:$id,name:\"\"){name...F}}fragment F on User{age}",
        calculator.signature(doc(source), "Q"));
  }

  @Test
  @DisplayName("Formatting, comments and literal values do not change the signature")
  void equivalentDocumentsShareSignature() {
    String a = "query Hello { hello(greeting: \"hi\", times: 3) { text } }";
    String b = "# a comment\nquery   Hello {\n  hello(greeting: \"bye\" times: 42) {\n text }\n}";

    assertEquals(calculator.signature(doc(a), "Hello"), calculator.signature(doc(b), "Hello"));
  }

  @Test
  void listAndObjectArgumentsAreCollapsed() {
    String source = "{ search(ids: [1, 2, 3], filter: {name: \"x\", tags: [\"a\"]}) { id } }";

    assertEquals("{search(ids:[],filter:{}){id}}", calculator.signature(doc(source), ""));
  }

  @Test
  @DisplayName("Operation directive arguments are literals, not variable types")
  void operationDirectiveArgumentsAreCollapsed() {
    String twoIds = calculator.signature(doc("query Q @tag(ids: [1, 2]) { a }"), "Q");
    String oneId = calculator.signature(doc("query Q @tag(ids: [3]) { a }"), "Q");

    assertEquals("query Q@tag(ids:[]){a}", twoIds);
    assertEquals(twoIds, oneId);
    assertEquals(
        "query Q($ids:[ID!])@tag(ids:[]){a}",
        calculator.signature(doc("query Q($ids: [ID!]) @tag(ids: [7]) { a }"), "Q"));
  }

  @Test
  void selectsNamedOperationFromMultiOperationDocument() {
    String source = "query A { a } query B { b }";

    assertEquals("query B{b}", calculator.signature(doc(source), "B"));
    assertEquals("query A{a}", calculator.signature(doc(source), null));
  }

  @Test
  void fragmentsAreOrderedByName() {
    String source =
        "query Q { ...Zed ...Alpha } fragment Zed on Query { z } fragment Alpha on Query { a }";

    assertEquals(
        "query Q{...Zed...Alpha}fragment Alpha on Query{a}fragment Zed on Query{z}",
        calculator.signature(doc(source), "Q"));
  }

  @Test
  void unknownOperationNameFails() {
    assertThrows(
        IllegalArgumentException.class, () -> calculator.signature(doc("query A { a }"), "B"));
  }
}
