package edu.isi.wfst;

// visits states in a fixed topological order; only valid on acyclic (sub)graphs
class TopOrderQueue implements StateQueue {
	// position of each state in the order
	private final int[] order;
	// state queued at each position, or NO_STATE_ID
	private final int[] queued;
	private int front = 0;
	private int back = -1;

	TopOrderQueue(int[] order) {
		this.order = order;
		queued = new int[order.length];
		for (int i = 0; i < queued.length; i++)
			queued[i] = Fst.NO_STATE_ID;
	}

	public void enqueue(int s) {
		int p = order[s];
		if (front > back)
			front = back = p;
		else if (p > back)
			back = p;
		else if (p < front)
			front = p;
		queued[p] = s;
	}
	public int dequeue() {
		int s = queued[front];
		queued[front] = Fst.NO_STATE_ID;
		while (front <= back && queued[front] == Fst.NO_STATE_ID)
			front++;
		return s;
	}
	public void update(int s) {
	}
	public boolean isEmpty() {
		return front > back;
	}
	public void clear() {
		for (int p = front; p <= back; p++)
			queued[p] = Fst.NO_STATE_ID;
		front = 0;
		back = -1;
	}
}
