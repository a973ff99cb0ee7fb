package com.glitchtrip;

import javax.swing.JPanel;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Shows the current image fitted to the panel with the attractor markers on
 * top. Dragging anywhere moves the marker nearest to the pointer.
 */
public class PreviewPanel extends JPanel
{

	private static final Color MARKER_FILL = new Color(255, 51, 153, 153);
	private static final Color MARKER_EDGE = new Color(255, 255, 255, 200);
	private static final int MARKER_RADIUS = 9;

	private BufferedImage image;
	private List<AttractorPoint> attractors = List.of();
	private Consumer<List<AttractorPoint>> onAttractorsChanged;

	private int dragIndex = -1;
	private int lastMouseX, lastMouseY;

	public PreviewPanel()
	{
		setPreferredSize(new Dimension(800, 800));
		setBackground(Color.BLACK);

		MouseAdapter mouse = new MouseAdapter()
		{
			@Override
			public void mousePressed(MouseEvent e)
			{
				Rectangle area = imageArea();
				if (area == null || attractors.isEmpty()) return;
				float nx = (e.getX() - area.x) / (float) area.width;
				float ny = (e.getY() - area.y) / (float) area.height;
				dragIndex = AttractorPoint.nearest(attractors, nx, ny);
				lastMouseX = e.getX();
				lastMouseY = e.getY();
			}

			@Override
			public void mouseDragged(MouseEvent e)
			{
				Rectangle area = imageArea();
				if (dragIndex < 0 || area == null) return;
				float dx = (e.getX() - lastMouseX) / (float) area.width;
				float dy = (e.getY() - lastMouseY) / (float) area.height;
				lastMouseX = e.getX();
				lastMouseY = e.getY();

				List<AttractorPoint> moved = new ArrayList<>(attractors);
				moved.set(dragIndex, moved.get(dragIndex).moveBy(dx, dy));
				attractors = List.copyOf(moved);
				repaint();
			}

			@Override
			public void mouseReleased(MouseEvent e)
			{
				if (dragIndex < 0) return;
				dragIndex = -1;
				if (onAttractorsChanged != null)
				{
					onAttractorsChanged.accept(attractors);
				}
			}
		};
		addMouseListener(mouse);
		addMouseMotionListener(mouse);
	}

	public void setImage(BufferedImage image)
	{
		this.image = image;
		repaint();
	}

	public void setAttractors(List<AttractorPoint> attractors)
	{
		this.attractors = List.copyOf(attractors);
		repaint();
	}

	public List<AttractorPoint> getAttractors()
	{
		return attractors;
	}

	public void setOnAttractorsChanged(Consumer<List<AttractorPoint>> listener)
	{
		this.onAttractorsChanged = listener;
	}

	/** Where the image is drawn, or null when nothing is loaded. */
	private Rectangle imageArea()
	{
		if (image == null || getWidth() <= 0 || getHeight() <= 0) return null;
		double fit = Math.min(getWidth() / (double) image.getWidth(), getHeight() / (double) image.getHeight());
		int drawW = Math.max(1, (int) (image.getWidth() * fit));
		int drawH = Math.max(1, (int) (image.getHeight() * fit));
		return new Rectangle((getWidth() - drawW) / 2, (getHeight() - drawH) / 2, drawW, drawH);
	}

	@Override
	protected void paintComponent(Graphics g)
	{
		super.paintComponent(g);
		Graphics2D g2 = (Graphics2D) g;

		Rectangle area = imageArea();
		if (area == null)
		{
			g2.setColor(Color.GRAY);
			String msg = "Load an image to start glitching";
			int sw = g2.getFontMetrics().stringWidth(msg);
			g2.drawString(msg, (getWidth() - sw) / 2, getHeight() / 2);
			return;
		}

		g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
		g2.drawImage(image, area.x, area.y, area.width, area.height, null);

		g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
		g2.setStroke(new BasicStroke(1.5f));
		for (AttractorPoint p : attractors)
		{
			int cx = area.x + Math.round(p.x() * area.width);
			int cy = area.y + Math.round(p.y() * area.height);
			g2.setColor(MARKER_FILL);
			g2.fillOval(cx - MARKER_RADIUS, cy - MARKER_RADIUS, MARKER_RADIUS * 2, MARKER_RADIUS * 2);
			g2.setColor(MARKER_EDGE);
			g2.drawOval(cx - MARKER_RADIUS, cy - MARKER_RADIUS, MARKER_RADIUS * 2, MARKER_RADIUS * 2);
		}
	}
}
