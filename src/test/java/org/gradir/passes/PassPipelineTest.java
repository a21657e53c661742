/*
 * Copyright 2025 The Gradir Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.gradir.passes;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.gradir.ir.Graph;
import org.gradir.ir.GraphInvariantError;
import org.gradir.ir.Node;
import org.gradir.ir.NodeKind;
import org.gradir.ir.Type;
import org.gradir.ir.Value;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PassPipelineTest {

  static final NodeKind NEG = NodeKind.of("aten::neg");

  /** A pass that moves the first node of the graph to the end, after any nodes that use it. */
  static class MoveFirstToEnd implements GraphPass {
    @Override
    public String name() {
      return "MoveFirstToEnd";
    }

    @Override
    public void run(Graph graph, PassMonitor monitor) {
      List<Node> nodes = graph.nodes();
      Node first = nodes.get(0);
      monitor.nodeRewritten(this, first, "moved");
      first.moveAfter(nodes.get(nodes.size() - 1));
    }
  }

  /** Records each event as a string. */
  static class Recorder implements PassMonitor {
    final List<String> events = new ArrayList<>();

    @Override
    public void passStarted(GraphPass pass, Graph graph) {
      events.add("start " + pass.name());
    }

    @Override
    public void passFinished(GraphPass pass, Graph graph) {
      events.add("finish " + pass.name());
    }

    @Override
    public void nodeRewritten(GraphPass pass, Node node, String action) {
      events.add(pass.name() + " " + action + " " + node.kind());
    }
  }

  private Graph g;

  @Before
  public void setup() {
    g = new Graph();
    Value a = g.addInput(Type.TENSOR).setDebugName("a");
    Value b = g.addInput(Type.UNDEFINED_TENSOR).setDebugName("b");
    Node add = g.appendNode(g.create(NodeKind.AUTOGRAD_ADD, a, b));
    Node neg = g.appendNode(g.create(NEG, add.output()));
    g.registerOutput(neg.output());
  }

  @Test
  public void runsPassesInOrder() {
    Recorder recorder = new Recorder();
    SpecializeUndef specialize = new SpecializeUndef();
    PassPipeline pipeline =
        PassPipeline.builder().add(specialize).add(specialize).monitor(recorder).build();

    pipeline.run(g);

    assertThat(recorder.events)
        .containsExactly(
            "start SpecializeUndef",
            "SpecializeUndef replaced by first argument prim::AutogradAdd",
            "finish SpecializeUndef",
            "start SpecializeUndef",
            "finish SpecializeUndef")
        .inOrder();
    assertThat(g.toString())
        .isEqualTo(
            """
            graph(%a : Tensor, %b : UndefinedTensor) {
              %3 : Dynamic = aten::neg(%a)
              return (%3);
            }
            """);
  }

  @Test
  public void brokenGraphIsReported() {
    PassPipeline pipeline = PassPipeline.builder().add(new MoveFirstToEnd()).build();
    GraphInvariantError e = assertThrows(GraphInvariantError.class, () -> pipeline.run(g));
    assertThat(e).hasMessageThat().isEqualTo("Graph is inconsistent after MoveFirstToEnd");
    assertThat(e).hasCauseThat().isInstanceOf(GraphInvariantError.class);
    assertThat(e).hasCauseThat().hasMessageThat().contains("not defined before it");
  }

  @Test
  public void passesAfterAFailureAreNotRun() {
    Recorder recorder = new Recorder();
    PassPipeline pipeline =
        PassPipeline.builder()
            .add(new MoveFirstToEnd())
            .add(new SpecializeUndef())
            .monitor(recorder)
            .build();
    assertThrows(GraphInvariantError.class, () -> pipeline.run(g));
    assertThat(recorder.events)
        .containsExactly("start MoveFirstToEnd", "MoveFirstToEnd moved prim::AutogradAdd")
        .inOrder();
  }

  @Test
  public void lintCanBeDisabled() {
    PassPipeline pipeline =
        PassPipeline.builder().add(new MoveFirstToEnd()).lintAfterEachPass(false).build();
    assertThat(pipeline.lint).isFalse();
    pipeline.run(g);
    assertThat(g.nodes().get(0).kind()).isSameInstanceAs(NEG);
  }

  @Test
  public void inputGraphIsChecked() {
    // Corrupt the graph before running anything.
    new MoveFirstToEnd().run(g);
    Recorder recorder = new Recorder();
    PassPipeline pipeline =
        PassPipeline.builder().add(new SpecializeUndef()).monitor(recorder).build();
    assertThrows(GraphInvariantError.class, () -> pipeline.run(g));
    assertThat(recorder.events).isEmpty();
  }

  @Test
  public void printingMonitor() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, UTF_8);
    PassPipeline.builder()
        .add(new SpecializeUndef())
        .monitor(new PassMonitor.Printing(out, false))
        .build()
        .run(g);
    assertThat(bytes.toString(UTF_8))
        .isEqualTo(
            """
            ** SpecializeUndef: started
            ** SpecializeUndef: replaced by first argument %2 : Dynamic = prim::AutogradAdd(%a, %b)
            ** SpecializeUndef: finished
            """
                .replace("\n", System.lineSeparator()));
  }

  @Test
  public void verbosePrintingMonitorShowsGraphs() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, UTF_8);
    PassPipeline.builder()
        .add(new SpecializeUndef())
        .monitor(new PassMonitor.Printing(out, true))
        .build()
        .run(g);
    String log = bytes.toString(UTF_8);
    assertThat(log).contains("prim::AutogradAdd(%a, %b)\n  %3 : Dynamic = aten::neg(%2)");
    assertThat(log).endsWith("  %3 : Dynamic = aten::neg(%a)\n  return (%3);\n}\n");
  }
}
