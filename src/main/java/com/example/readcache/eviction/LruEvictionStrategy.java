package com.example.readcache.eviction;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Least-recently-used ordering over an explicit doubly linked list.
 *
 * <p>Head is the most recently used key, tail the eviction candidate. New keys enter
 * at the head, so among keys never touched again the oldest insert is evicted first.
 * Hit, insert, remove and victim selection are all O(1).
 */
public class LruEvictionStrategy implements EvictionStrategy {

    private static class Node {
        final String key;
        Node prev;
        Node next;

        Node(String key) {
            this.key = key;
        }
    }

    // Key -> Node map for O(1) access
    private final Map<String, Node> nodeMap = new HashMap<>();

    private Node head;
    private Node tail;

    @Override
    public void onHit(String key) {
        Node node = nodeMap.get(key);
        if (node != null && node != head) {
            unlink(node);
            addToHead(node);
        }
    }

    @Override
    public void onInsert(String key) {
        Node node = nodeMap.get(key);
        if (node != null) {
            // replace counts as a fresh touch
            onHit(key);
            return;
        }
        node = new Node(key);
        nodeMap.put(key, node);
        addToHead(node);
    }

    @Override
    public void onRemove(String key) {
        Node node = nodeMap.remove(key);
        if (node != null) {
            unlink(node);
        }
    }

    @Override
    public Optional<String> selectVictim() {
        Node victim = tail;
        if (victim == null) {
            return Optional.empty();
        }
        unlink(victim);
        nodeMap.remove(victim.key);
        return Optional.of(victim.key);
    }

    @Override
    public void clear() {
        nodeMap.clear();
        head = null;
        tail = null;
    }

    // --- Doubly linked list operations ---

    private void addToHead(Node node) {
        node.prev = null;
        node.next = head;
        if (head != null) {
            head.prev = node;
        }
        head = node;
        if (tail == null) {
            tail = node;
        }
    }

    private void unlink(Node node) {
        if (node.prev != null) {
            node.prev.next = node.next;
        } else {
            head = node.next;
        }

        if (node.next != null) {
            node.next.prev = node.prev;
        } else {
            tail = node.prev;
        }
        node.prev = null;
        node.next = null;
    }
}
