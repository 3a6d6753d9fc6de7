package edu.isi.wfst;

import gnu.trove.stack.array.TIntArrayStack;

class LifoQueue implements StateQueue {
	private final TIntArrayStack states = new TIntArrayStack();

	public void enqueue(int s) {
		states.push(s);
	}
	public int dequeue() {
		return states.pop();
	}
	public void update(int s) {
	}
	public boolean isEmpty() {
		return states.size() == 0;
	}
	public void clear() {
		states.clear();
	}
}
