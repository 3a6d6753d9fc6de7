package edu.isi.wfst;

import edu.stanford.nlp.util.BinaryHeapPriorityQueue;

// lowest current distance first. The heap favors high priorities, so distances go in negated
class ShortestFirstQueue implements StateQueue {
	private final BinaryHeapPriorityQueue<Integer> heap = new BinaryHeapPriorityQueue<Integer>();
	private final float[] distance;

	ShortestFirstQueue(float[] distance) {
		this.distance = distance;
	}

	public void enqueue(int s) {
		heap.add(s, -distance[s]);
	}
	public int dequeue() {
		return heap.removeFirst();
	}
	public void update(int s) {
		heap.relaxPriority(s, -distance[s]);
	}
	public boolean isEmpty() {
		return heap.isEmpty();
	}
	public void clear() {
		while (!heap.isEmpty())
			heap.removeFirst();
	}
}
