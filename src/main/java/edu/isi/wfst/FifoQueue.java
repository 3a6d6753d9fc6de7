package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;

class FifoQueue implements StateQueue {
	private final TIntArrayList states = new TIntArrayList();
	private int head = 0;

	public void enqueue(int s) {
		states.add(s);
	}
	public int dequeue() {
		int s = states.get(head++);
		// reclaim space once everything queued so far has been seen
		if (head == states.size()) {
			states.resetQuick();
			head = 0;
		}
		return s;
	}
	public void update(int s) {
	}
	public boolean isEmpty() {
		return head >= states.size();
	}
	public void clear() {
		states.resetQuick();
		head = 0;
	}
}
