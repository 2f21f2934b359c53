package it.aw.collectionindex.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.SplittableRandom;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Sorted set in memoria con rank in O(log N): treap con dimensione dei sottoalberi.
 * <p>
 * Ordinamento per score crescente e, a parità di score, per member
 * (come i sorted set di Redis). Le letture condividono il lock, le scritture lo
 * prendono in esclusiva per la sola durata dell'operazione.
 */
final class RankedSet {

    private static final class Node {
        final String member;
        final double score;
        final int priority;
        Node left;
        Node right;
        int size = 1;

        Node(String member, double score, int priority) {
            this.member = member;
            this.score = score;
            this.priority = priority;
        }
    }

    private final Map<String, Double> scores = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final SplittableRandom random = new SplittableRandom();
    private Node root;

    /** Inserisce o aggiorna lo score di {@code member}. */
    void add(String member, double score) {
        lock.writeLock().lock();
        try {
            Double previous = scores.put(member, score);
            if (previous != null) {
                if (Double.compare(previous, score) == 0) {
                    return;
                }
                root = delete(root, previous, member);
            }
            Node[] parts = split(root, score, member);
            root = merge(merge(parts[0], new Node(member, score, random.nextInt())), parts[1]);
        } finally {
            lock.writeLock().unlock();
        }
    }

    boolean remove(String member) {
        lock.writeLock().lock();
        try {
            Double previous = scores.remove(member);
            if (previous == null) {
                return false;
            }
            root = delete(root, previous, member);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    OptionalLong rank(String member) {
        lock.readLock().lock();
        try {
            Double score = scores.get(member);
            if (score == null) {
                return OptionalLong.empty();
            }
            long rank = 0;
            Node node = root;
            while (node != null) {
                int cmp = compare(score, member, node);
                if (cmp < 0) {
                    node = node.left;
                } else if (cmp > 0) {
                    rank += size(node.left) + 1;
                    node = node.right;
                } else {
                    return OptionalLong.of(rank + size(node.left));
                }
            }
            return OptionalLong.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Range per rank con la semantica di ZRANGE (indici negativi dalla fine, estremi inclusi). */
    List<String> range(long start, long stop) {
        lock.readLock().lock();
        try {
            long size = size(root);
            long from = start < 0 ? Math.max(0, size + start) : start;
            long to = stop < 0 ? size + stop : Math.min(stop, size - 1);
            List<String> out = new ArrayList<>();
            if (from > to || from >= size) {
                return out;
            }
            collect(root, from, to, 0, out);
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    long size() {
        lock.readLock().lock();
        try {
            return size(root);
        } finally {
            lock.readLock().unlock();
        }
    }

    boolean isEmpty() {
        return size() == 0;
    }

    // -------------------------------------------------------------------------
    // Treap
    // -------------------------------------------------------------------------

    private static int size(Node node) {
        return node == null ? 0 : node.size;
    }

    private static void update(Node node) {
        node.size = 1 + size(node.left) + size(node.right);
    }

    private static int compare(double score, String member, Node node) {
        int cmp = Double.compare(score, node.score);
        return cmp != 0 ? cmp : member.compareTo(node.member);
    }

    /** Divide in ({@code < key}, {@code >= key}). */
    private static Node[] split(Node node, double score, String member) {
        if (node == null) {
            return new Node[] {null, null};
        }
        if (compare(score, member, node) > 0) {
            Node[] parts = split(node.right, score, member);
            node.right = parts[0];
            update(node);
            return new Node[] {node, parts[1]};
        }
        Node[] parts = split(node.left, score, member);
        node.left = parts[1];
        update(node);
        return new Node[] {parts[0], node};
    }

    /** Unisce due treap in cui ogni chiave di {@code a} precede ogni chiave di {@code b}. */
    private static Node merge(Node a, Node b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        if (a.priority > b.priority) {
            a.right = merge(a.right, b);
            update(a);
            return a;
        }
        b.left = merge(a, b.left);
        update(b);
        return b;
    }

    private static Node delete(Node node, double score, String member) {
        if (node == null) {
            return null;
        }
        int cmp = compare(score, member, node);
        if (cmp == 0) {
            return merge(node.left, node.right);
        }
        if (cmp < 0) {
            node.left = delete(node.left, score, member);
        } else {
            node.right = delete(node.right, score, member);
        }
        update(node);
        return node;
    }

    private static void collect(Node node, long from, long to, long offset, List<String> out) {
        if (node == null) {
            return;
        }
        long nodeRank = offset + size(node.left);
        if (from < nodeRank) {
            collect(node.left, from, to, offset, out);
        }
        if (from <= nodeRank && nodeRank <= to) {
            out.add(node.member);
        }
        if (to > nodeRank) {
            collect(node.right, from, to, nodeRank + 1, out);
        }
    }
}
