package edu.isi.wfst;

// discipline in which a shortest distance computation visits states
interface StateQueue {
	void enqueue(int s);
	// removes and returns the next state
	int dequeue();
	// the state's distance went down while it was queued
	void update(int s);
	boolean isEmpty();
	void clear();
}
