package fr.imt.jobdaemon.jobdaemon.business.scheduler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Binary min-heap with an index from element id to array slot, so that an element
 * can be removed or re-keyed in O(log n). Not thread-safe.
 */
public class IndexedMinHeap<E> {

    private final List<E> elements = new ArrayList<>();
    private final Map<String, Integer> positions = new HashMap<>();
    private final Function<E, String> idOf;
    private final Comparator<E> comparator;

    public IndexedMinHeap(Function<E, String> idOf, Comparator<E> comparator) {
        this.idOf = idOf;
        this.comparator = comparator;
    }

    /**
     * Inserts the element, replacing any element with the same id.
     */
    public void offer(E element) {
        String id = idOf.apply(element);
        Integer position = positions.get(id);
        if (position != null) {
            E previous = elements.set(position, element);
            if (comparator.compare(element, previous) < 0) {
                siftUp(position);
            } else {
                siftDown(position);
            }
            return;
        }
        elements.add(element);
        positions.put(id, elements.size() - 1);
        siftUp(elements.size() - 1);
    }

    public E peek() {
        return elements.isEmpty() ? null : elements.get(0);
    }

    public E poll() {
        if (elements.isEmpty()) {
            return null;
        }
        return removeAt(0);
    }

    public E remove(String id) {
        Integer position = positions.get(id);
        return position == null ? null : removeAt(position);
    }

    public E get(String id) {
        Integer position = positions.get(id);
        return position == null ? null : elements.get(position);
    }

    public boolean contains(String id) {
        return positions.containsKey(id);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public void clear() {
        elements.clear();
        positions.clear();
    }

    /**
     * Copy of the elements in heap order, not sorted.
     */
    public List<E> toList() {
        return new ArrayList<>(elements);
    }

    private E removeAt(int position) {
        int last = elements.size() - 1;
        E removed = elements.get(position);
        swap(position, last);
        elements.remove(last);
        positions.remove(idOf.apply(removed));
        if (position < elements.size()) {
            siftDown(position);
            siftUp(position);
        }
        return removed;
    }

    private void siftUp(int position) {
        int child = position;
        while (child > 0) {
            int parent = (child - 1) / 2;
            if (comparator.compare(elements.get(child), elements.get(parent)) >= 0) {
                break;
            }
            swap(child, parent);
            child = parent;
        }
    }

    private void siftDown(int position) {
        int parent = position;
        int size = elements.size();
        while (true) {
            int left = 2 * parent + 1;
            int right = left + 1;
            int smallest = parent;
            if (left < size && comparator.compare(elements.get(left), elements.get(smallest)) < 0) {
                smallest = left;
            }
            if (right < size && comparator.compare(elements.get(right), elements.get(smallest)) < 0) {
                smallest = right;
            }
            if (smallest == parent) {
                return;
            }
            swap(parent, smallest);
            parent = smallest;
        }
    }

    private void swap(int i, int j) {
        if (i == j) {
            return;
        }
        E first = elements.get(i);
        E second = elements.get(j);
        elements.set(i, second);
        elements.set(j, first);
        positions.put(idOf.apply(second), i);
        positions.put(idOf.apply(first), j);
    }
}
