package org.blockstruct;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recovers sequences, if-then and if-else ladders from an acyclic control flow graph.
 *
 * <p>The graph is reduced bottom-up: nodes are visited in postorder and the first pattern matching
 * at a node is collapsed into a single composite block, until nothing matches anymore. Patterns are
 * tried in this order:
 * <ol>
 *   <li>sequence: one successor, which has no other predecessor and at most one successor</li>
 *   <li>if-then: one branch has the node as only predecessor and flows into the other branch</li>
 *   <li>if-else: both branches flow into the same block (or both leave the function); the ladder of
 *       conditions jumping to the same else branch is absorbed as well</li>
 *   <li>if-then with early exit: one branch has the node as only predecessor and leaves the function</li>
 * </ol>
 * Structuring consumes the basic blocks: they become owned by the resulting tree.
 */
public class ControlFlowStructurer {
    private static final Logger logger = LoggerFactory.getLogger(ControlFlowStructurer.class);

    /**
     * @param root entry block of the graph, see {@link Analysis#cfg()}
     * @return the structured tree, or null for a null root
     * @throws UnstructurableRegionException if the graph does not reduce to a single block
     * @throws IllegalStateException if some block already belongs to a structured tree
     */
    public AbstractBlock structure(BasicBlock root) throws UnstructurableRegionException {
        return structure(root, 0);
    }

    /** Structures the graph of an analysis; composite ids never clash with its block ids */
    public AbstractBlock structure(Analysis analysis) throws UnstructurableRegionException {
        return structure(analysis.cfg(), analysis.getBlocks().size());
    }

    /**
     * @param firstId lowest id handed to composite blocks; ids above the reachable basic blocks are
     *                used anyway
     */
    public AbstractBlock structure(BasicBlock root, int firstId) throws UnstructurableRegionException {
        if (root == null) return null;
        WorkGraph graph = new WorkGraph(root, firstId);
        graph.reduce();
        return graph.result();
    }

    /** block created by a reduction, the nodes it replaces and its only successor (if any) */
    private static final class Reduction {
        final AbstractBlock block;
        final List<AbstractBlock> members;
        final AbstractBlock exit;

        Reduction(AbstractBlock block, List<AbstractBlock> members, AbstractBlock exit) {
            this.block = block;
            this.members = members;
            this.exit = exit;
        }
    }

    private static final class WorkGraph {
        private AbstractBlock root;
        private Map<AbstractBlock, List<AbstractBlock>> succs = new LinkedHashMap<>();
        private Map<AbstractBlock, List<AbstractBlock>> preds;
        private int nextId;

        WorkGraph(BasicBlock entry, int firstId) {
            root = entry;
            int maxId = entry.getId();
            Deque<BasicBlock> stack = new ArrayDeque<>();
            stack.push(entry);
            while (!stack.isEmpty()) {
                BasicBlock block = stack.pop();
                if (succs.containsKey(block)) continue;
                AbstractBlock.checkAdoptable(block);
                List<AbstractBlock> out = new ArrayList<>(2);
                if (block.getNext() != null) {
                    out.add(block.getNext());
                    stack.push(block.getNext());
                }
                if (block.getCond() != null && block.getCond() != block.getNext()) {
                    out.add(block.getCond());
                    stack.push(block.getCond());
                }
                succs.put(block, out);
                maxId = Math.max(maxId, block.getId());
            }
            nextId = Math.max(maxId + 1, firstId);
        }

        void reduce() {
            while (true) {
                preds = predecessors();
                Reduction reduction = null;
                for (AbstractBlock node : postorder()) {
                    reduction = reduceSequence(node);
                    if (reduction == null) reduction = reduceIfThen(node);
                    if (reduction == null) reduction = reduceIfElse(node);
                    if (reduction == null) reduction = reduceEarlyExit(node);
                    if (reduction != null) break;
                }
                if (reduction == null) return;
                logger.debug("{} -> {}", reduction.members, reduction.block);
                replace(reduction);
            }
        }

        AbstractBlock result() throws UnstructurableRegionException {
            if (succs.size() == 1 && succs.get(root).isEmpty()) return root;
            List<AbstractBlock> regions = postorder();
            Collections.reverse(regions);
            logger.debug("{} regions left: {}", regions.size(), regions);
            throw new UnstructurableRegionException(
                    regions.size() + " regions left after structuring, starting at " + root, regions);
        }

        private Reduction reduceSequence(AbstractBlock node) {
            List<AbstractBlock> out = succs.get(node);
            if (out.size() != 1) return null;
            AbstractBlock next = out.get(0);
            if (next == node || next == root || preds.get(next).size() != 1) return null;
            List<AbstractBlock> nextOut = succs.get(next);
            // a sequence never has two exits
            if (nextOut.size() > 1) return null;
            SequenceBlock block = new SequenceBlock(nextId++, node, next);
            return new Reduction(block, List.of(node, next), nextOut.isEmpty() ? null : nextOut.get(0));
        }

        private Reduction reduceIfThen(AbstractBlock node) {
            List<AbstractBlock> out = succs.get(node);
            if (!(node instanceof BasicBlock) || out.size() != 2) return null;
            AbstractBlock then;
            AbstractBlock cont;
            if (flowsInto(node, out.get(0), out.get(1))) {
                then = out.get(0);
                cont = out.get(1);
            } else if (flowsInto(node, out.get(1), out.get(0))) {
                then = out.get(1);
                cont = out.get(0);
            } else {
                return null;
            }
            IfThenBlock block = new IfThenBlock(nextId++, (BasicBlock) node, then);
            return new Reduction(block, List.of(node, then), cont);
        }

        private Reduction reduceIfElse(AbstractBlock node) {
            List<AbstractBlock> out = succs.get(node);
            if (!(node instanceof BasicBlock) || out.size() != 2) return null;
            AbstractBlock then = out.get(0);
            AbstractBlock elseBranch = out.get(1);
            // the else branch is the one shared by the ladder
            if (preds.get(then).size() > 1) {
                if (preds.get(elseBranch).size() != 1) return null;
                then = out.get(1);
                elseBranch = out.get(0);
            }
            if (then == node || elseBranch == node) return null;

            List<AbstractBlock> thenOut = succs.get(then);
            List<AbstractBlock> elseOut = succs.get(elseBranch);
            if (thenOut.size() > 1 || thenOut.size() != elseOut.size()) return null;
            AbstractBlock exit = thenOut.isEmpty() ? null : thenOut.get(0);
            if (exit != null && exit != elseOut.get(0)) return null;

            // climb the ladder: every outer head jumps either to the inner one or to the else branch
            List<AbstractBlock> heads = new ArrayList<>();
            heads.add(node);
            AbstractBlock current = node;
            while (preds.get(current).size() == 1) {
                AbstractBlock pred = preds.get(current).get(0);
                if (!(pred instanceof BasicBlock) || heads.contains(pred) || pred == then || pred == elseBranch)
                    break;
                List<AbstractBlock> predOut = succs.get(pred);
                if (predOut.size() != 2 || !predOut.contains(elseBranch)) break;
                heads.add(pred);
                current = pred;
            }
            List<AbstractBlock> elsePreds = preds.get(elseBranch);
            if (elsePreds.size() != heads.size() || !heads.containsAll(elsePreds)) return null;
            if (exit != null && (exit == then || exit == elseBranch || heads.contains(exit))) return null;

            BasicBlock outermost = (BasicBlock) heads.get(heads.size() - 1);
            IfElseBlock block = new IfElseBlock(nextId++, outermost, then, elseBranch);
            List<AbstractBlock> members = new ArrayList<>(heads);
            members.add(then);
            members.add(elseBranch);
            return new Reduction(block, members, exit);
        }

        private Reduction reduceEarlyExit(AbstractBlock node) {
            List<AbstractBlock> out = succs.get(node);
            if (!(node instanceof BasicBlock) || out.size() != 2) return null;
            AbstractBlock then;
            AbstractBlock cont;
            if (leavesFunction(node, out.get(0))) {
                then = out.get(0);
                cont = out.get(1);
            } else if (leavesFunction(node, out.get(1))) {
                then = out.get(1);
                cont = out.get(0);
            } else {
                return null;
            }
            IfThenBlock block = new IfThenBlock(nextId++, (BasicBlock) node, then);
            return new Reduction(block, List.of(node, then), cont);
        }

        // branch entered only from head and falling into cont
        private boolean flowsInto(AbstractBlock head, AbstractBlock branch, AbstractBlock cont) {
            if (branch == head || branch == cont) return false;
            List<AbstractBlock> out = succs.get(branch);
            return preds.get(branch).size() == 1 && out.size() == 1 && out.get(0) == cont;
        }

        // branch entered only from head and with no successors
        private boolean leavesFunction(AbstractBlock head, AbstractBlock branch) {
            return branch != head && preds.get(branch).size() == 1 && succs.get(branch).isEmpty();
        }

        private void replace(Reduction reduction) {
            Set<AbstractBlock> members = new HashSet<>(reduction.members);
            Map<AbstractBlock, List<AbstractBlock>> remapped = new LinkedHashMap<>();
            for (Map.Entry<AbstractBlock, List<AbstractBlock>> e : succs.entrySet()) {
                if (members.contains(e.getKey())) continue;
                List<AbstractBlock> out = new ArrayList<>(e.getValue().size());
                for (AbstractBlock succ : e.getValue()) {
                    AbstractBlock target = members.contains(succ) ? reduction.block : succ;
                    if (!out.contains(target)) out.add(target);
                }
                remapped.put(e.getKey(), out);
            }
            List<AbstractBlock> out = new ArrayList<>(1);
            if (reduction.exit != null)
                out.add(members.contains(reduction.exit) ? reduction.block : reduction.exit);
            remapped.put(reduction.block, out);
            if (members.contains(root)) root = reduction.block;
            succs = remapped;

            // drop whatever is no longer reachable from the root
            Set<AbstractBlock> reachable = new HashSet<>(postorder());
            succs.keySet().retainAll(reachable);
        }

        private Map<AbstractBlock, List<AbstractBlock>> predecessors() {
            Map<AbstractBlock, List<AbstractBlock>> result = new HashMap<>();
            for (AbstractBlock node : succs.keySet()) result.put(node, new ArrayList<>(2));
            for (Map.Entry<AbstractBlock, List<AbstractBlock>> e : succs.entrySet()) {
                for (AbstractBlock succ : e.getValue()) result.get(succ).add(e.getKey());
            }
            return result;
        }

        private List<AbstractBlock> postorder() {
            List<AbstractBlock> order = new ArrayList<>(succs.size());
            Set<AbstractBlock> visited = new HashSet<>();
            Deque<AbstractBlock> nodes = new ArrayDeque<>();
            Deque<Iterator<AbstractBlock>> pending = new ArrayDeque<>();
            visited.add(root);
            nodes.push(root);
            pending.push(succs.get(root).iterator());
            while (!nodes.isEmpty()) {
                Iterator<AbstractBlock> it = pending.peek();
                if (it.hasNext()) {
                    AbstractBlock child = it.next();
                    if (visited.add(child)) {
                        nodes.push(child);
                        pending.push(succs.get(child).iterator());
                    }
                } else {
                    order.add(nodes.pop());
                    pending.pop();
                }
            }
            return order;
        }
    }
}
