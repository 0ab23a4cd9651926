package com.gruelbox.retry;

/** How an operation refers to the object it is invoked on, if any. */
public enum ReceiverKind {

  /** A free-standing operation (a static method or function). */
  NONE,

  /** A shared, non-owning reference. Can be reused across attempts. */
  SHARED,

  /** An exclusive, mutable borrow. Can't be held across attempts; not supported. */
  EXCLUSIVE,

  /** The receiver is consumed by the call. Can't be reused; not supported. */
  OWNED
}
