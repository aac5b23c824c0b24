package io.jscribe.engine;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import io.jscribe.engine.host.DestinationWriter;
import io.jscribe.engine.host.SourceResolver;
import java.io.IOException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class CompilerTest {

  private DestinationWriter writer;

  @BeforeEach
  void setUp() {
    writer = mock(DestinationWriter.class);
  }

  @Test
  void everyRootWithDestinationIsWrittenOnce() throws Exception {
    Compiler compiler =
        Compiler.builder()
            .config(EngineConfig.defaults().withMainDestination("book.txt"))
            .writer(writer)
            .build();

    CompilationResult result =
        compiler.compileSource(
            "book.psc",
            "$branch.create.root[html][web][book.html]"
                + "$branch.create.root[text][scratch][]"
                + "$branch.write[web][<p>hi</p>]"
                + "$branch.write[scratch][kept in memory]"
                + "main text");

    InOrder inOrder = inOrder(writer);
    inOrder.verify(writer).write("book.txt", "text", "main text");
    inOrder.verify(writer).write("book.html", "html", "<p>hi</p>");
    verifyNoMoreInteractions(writer);
    assertEquals("kept in memory", result.text("scratch"));
    assertEquals(3, result.branches().size());
  }

  @Test
  void nothingIsWrittenWhenExpansionFails() throws Exception {
    Compiler compiler =
        Compiler.builder()
            .config(EngineConfig.defaults().withMainDestination("out.txt"))
            .writer(writer)
            .build();

    assertThrows(UndefinedMacroException.class, () -> compiler.compileSource("x.psc", "ok $bad"));
    verify(writer, never()).write(any(), any(), any());
  }

  @Test
  void nothingIsWrittenWhenAnyRootHasACycle() throws Exception {
    Compiler compiler =
        Compiler.builder()
            .config(EngineConfig.defaults().withMainDestination("out.txt"))
            .writer(writer)
            .build();
    String source =
        "fine"
            + "$branch.create.root[text][other][other.txt]"
            + "$branch.write[other][$branch.create.sub[loop]$branch.append[loop]]"
            + "$branch.write[loop][$branch.append[loop]]";

    CycleException e =
        assertThrows(CycleException.class, () -> compiler.compileSource("c.psc", source));
    assertEquals("loop", e.getChain().get(e.getChain().size() - 1));
    verify(writer, never()).write(any(), any(), any());
  }

  @Test
  void writerFailurePropagates() throws Exception {
    doThrow(new IOException("read-only")).when(writer).write(any(), any(), any());
    Compiler compiler =
        Compiler.builder()
            .config(EngineConfig.defaults().withMainDestination("out.txt"))
            .writer(writer)
            .build();

    IOException e = assertThrows(IOException.class, () -> compiler.compileSource("w.psc", "x"));
    assertEquals("read-only", e.getMessage());
  }

  @Test
  void writerFailureStopsLaterWrites() throws Exception {
    doThrow(new IOException("disk full")).when(writer).write(eq("b.txt"), any(), any());
    Compiler compiler =
        Compiler.builder()
            .config(EngineConfig.defaults().withMainDestination("a.txt"))
            .writer(writer)
            .build();
    String source =
        "$branch.create.root[text][b][b.txt]"
            + "$branch.create.root[text][c][c.txt]"
            + "main";

    assertThrows(IOException.class, () -> compiler.compileSource("p.psc", source));
    verify(writer).write("a.txt", "text", "main");
    verify(writer).write("b.txt", "text", "");
    verify(writer, never()).write(eq("c.txt"), any(), any());
  }

  @Test
  void bindingsAreOrdinaryMacros() throws Exception {
    Compiler compiler =
        Compiler.builder()
            .bind("format", "html")
            .bindings(Map.of("device", "phone"))
            .build();
    String source =
        "$macro.new[open.html][<html>]"
            + "$macro.call[open.$format] $device $if.def[format][set]";

    assertEquals("<html> phone set", compiler.compileSource("b.psc", source).mainText());
  }

  @Test
  void bindingNamesAreValidated() {
    assertThrows(IllegalArgumentException.class, () -> Compiler.builder().bind("not valid", "x"));
  }

  @Test
  void bindingCannotShadowBuiltin() {
    Compiler compiler = Compiler.builder().bind("roman", "x").build();

    assertThrows(RedefinitionException.class, () -> compiler.compileSource("b.psc", ""));
  }

  @Test
  void unitsDoNotShareState() throws Exception {
    Compiler compiler = Compiler.builder().build();

    compiler.compileSource("one.psc", "$macro.new[m][1]$counter.create[c]");
    CompilationResult second = compiler.compileSource("two.psc", "$macro.new[m][2]$m");

    assertEquals("2", second.mainText());
  }

  @Test
  void compileReadsEntryFromResolver() throws Exception {
    Compiler compiler =
        Compiler.builder().sources(SourceResolver.of(Map.of("entry.psc", "from file"))).build();

    assertEquals("from file", compiler.compile("entry.psc").mainText());
  }

  @Test
  void librariesCanBeAddedAndDiscovered() throws Exception {
    Compiler explicit = Compiler.builder().library(new GreetingLibrary()).build();
    Compiler discovered = Compiler.builder().discoverLibraries().build();

    assertEquals("hello from a library", explicit.compileSource("l.psc", "$greeting").mainText());
    assertEquals("hello from a library", discovered.compileSource("l.psc", "$greeting").mainText());
  }

  @Test
  void unknownRootInResult() throws Exception {
    CompilationResult result = Compiler.builder().build().compileSource("r.psc", "x");

    assertThrows(IllegalArgumentException.class, () -> result.text("nope"));
  }
}
